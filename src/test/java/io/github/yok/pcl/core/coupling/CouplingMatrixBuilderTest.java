package io.github.yok.pcl.core.coupling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import io.github.yok.pcl.core.window.FullSkyWindowFunction;
import io.github.yok.pcl.core.window.TabulatedWindowFunction;
import io.github.yok.pcl.core.window.WindowFunction;
import io.github.yok.pcl.core.wigner.LogFactorialWigner3jProvider;
import io.github.yok.pcl.core.wigner.Wigner3jProvider;
import java.util.concurrent.atomic.AtomicInteger;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class CouplingMatrixBuilderTest {

    private static final int LMAX = 8;

    private final CouplingMatrixBuilder builder = new CouplingMatrixBuilder();

    private final Wigner3jProvider wigner = new LogFactorialWigner3jProvider(2 * LMAX);

    /**
     * 減衰する裾を持つ、検証用の窓関数です。
     */
    private static WindowFunction maskLikeWindow() {
        double[] w = new double[2 * LMAX + 1];
        w[0] = 4.0 * Math.PI * 0.36;
        for (int l = 1; l < w.length; l++) {
            w[l] = 4.0 * Math.PI * 0.02 * Math.exp(-l / 3.0);
        }
        // 推定誤差で負になった値もそのまま扱う
        w[7] = -0.01;
        return new TabulatedWindowFunction(LMAX, w);
    }

    @Test
    void fullSkyWindowGivesIdentity() {
        DMatrixRMaj m = builder.build(LMAX, new FullSkyWindowFunction(LMAX), wigner);

        assertEquals(LMAX + 1, m.numRows);
        assertEquals(LMAX + 1, m.numCols);
        for (int i = 0; i <= LMAX; i++) {
            for (int j = 0; j <= LMAX; j++) {
                assertEquals((i == j) ? 1.0 : 0.0, m.get(i, j), 1e-12, "M[" + i + "," + j + "]");
            }
        }
    }

    @Test
    void reducedKernelIsSymmetric() {
        DMatrixRMaj m = builder.build(LMAX, maskLikeWindow(), wigner);

        // M[l1,l2] = (2 l2 + 1) S(l1,l2) / 4π で S は対称
        for (int l1 = 0; l1 <= LMAX; l1++) {
            for (int l2 = 0; l2 <= LMAX; l2++) {
                double s12 = m.get(l1, l2) / (2 * l2 + 1);
                double s21 = m.get(l2, l1) / (2 * l1 + 1);
                assertEquals(s12, s21, 1e-14, "l1=" + l1 + ", l2=" + l2);
            }
        }
    }

    @Test
    void monopoleRowMatchesClosedForm() {
        WindowFunction window = maskLikeWindow();
        DMatrixRMaj m = builder.build(LMAX, window, wigner);

        for (int l2 = 0; l2 <= LMAX; l2++) {
            double w = wigner.w000(0, l2, l2);
            double expected = (2 * l2 + 1) * (2 * l2 + 1) * w * w * window.valueAt(l2)
                    / (4.0 * Math.PI);
            assertEquals(expected, m.get(0, l2), 1e-14, "l2=" + l2);
        }
    }

    @Test
    void matchesDirectTripleSum() {
        WindowFunction window = maskLikeWindow();
        DMatrixRMaj m = builder.build(LMAX, window, wigner);

        for (int l1 = 0; l1 <= LMAX; l1++) {
            for (int l2 = 0; l2 <= LMAX; l2++) {
                double s = 0.0;
                for (int l3 = Math.abs(l1 - l2); l3 <= l1 + l2; l3++) {
                    if ((l1 + l2 + l3) % 2 == 0) {
                        double w = wigner.w000(l1, l2, l3);
                        s += (2 * l2 + 1) * (2 * l3 + 1) * w * w * window.valueAt(l3);
                    }
                }
                assertEquals(s / (4.0 * Math.PI), m.get(l1, l2), 1e-13,
                        "l1=" + l1 + ", l2=" + l2);
            }
        }
    }

    @Test
    void wignerIsCalledOnlyForAllowedTriples() {
        AtomicInteger calls = new AtomicInteger();
        Wigner3jProvider strict = (l1, l2, l3) -> {
            if (l3 < Math.abs(l1 - l2) || l3 > l1 + l2 || (l1 + l2 + l3) % 2 != 0) {
                fail("selection rule violated: " + l1 + "," + l2 + "," + l3);
            }
            calls.incrementAndGet();
            return wigner.w000(l1, l2, l3);
        };

        builder.build(LMAX, maskLikeWindow(), strict);

        assertTrue(calls.get() > 0);
    }

    @Test
    void windowShorterThanTwiceLmax_throws() {
        WindowFunction tooShort = new TabulatedWindowFunction(2, new double[] {1.0});

        assertThrows(IllegalArgumentException.class, () -> builder.build(LMAX, tooShort, wigner));
    }

    @Test
    void zeroLmaxGivesSingleMonopoleEntry() {
        DMatrixRMaj m = builder.build(0, new TabulatedWindowFunction(0, new double[] {2.0}),
                new LogFactorialWigner3jProvider(0));

        assertEquals(1, m.getNumElements());
        assertEquals(2.0 / (4.0 * Math.PI), m.get(0, 0), 1e-15);
    }
}
