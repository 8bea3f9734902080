package io.github.yok.pcl.core.wigner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class LogFactorialWigner3jProviderTest {

    private static final double TOL = 1e-12;

    private final LogFactorialWigner3jProvider wigner = new LogFactorialWigner3jProvider(20);

    @Test
    void knownValues() {
        assertEquals(1.0, wigner.w000(0, 0, 0), TOL);
        assertEquals(-1.0 / Math.sqrt(3.0), wigner.w000(1, 1, 0), TOL);
        assertEquals(1.0 / Math.sqrt(5.0), wigner.w000(2, 2, 0), TOL);
        assertEquals(Math.sqrt(2.0 / 15.0), wigner.w000(1, 1, 2), TOL);
        assertEquals(-Math.sqrt(2.0 / 35.0), wigner.w000(2, 2, 2), TOL);
        assertEquals(-Math.sqrt(3.0 / 35.0), wigner.w000(3, 2, 1), TOL);
    }

    @Test
    void valueIsSymmetricUnderPermutation() {
        double w = wigner.w000(4, 6, 8);
        assertEquals(w, wigner.w000(6, 4, 8), TOL);
        assertEquals(w, wigner.w000(8, 6, 4), TOL);
        assertEquals(w, wigner.w000(4, 8, 6), TOL);
    }

    @Test
    void monopoleRowSquaresToInverseDegeneracy() {
        for (int l = 0; l <= 20; l++) {
            double w = wigner.w000(0, l, l);
            assertEquals(1.0 / (2 * l + 1), w * w, TOL, "l=" + l);
        }
    }

    @Test
    void orthogonalityOverThirdMultipole() {
        // Σ_{l3} (2 l3 + 1) (l1 l2 l3; 0 0 0)^2 = 1
        for (int l1 = 0; l1 <= 8; l1++) {
            for (int l2 = 0; l2 <= 8; l2++) {
                double s = 0.0;
                for (int l3 = Math.abs(l1 - l2); l3 <= l1 + l2; l3++) {
                    double w = wigner.w000(l1, l2, l3);
                    s += (2 * l3 + 1) * w * w;
                }
                assertEquals(1.0, s, 1e-11, "l1=" + l1 + ", l2=" + l2);
            }
        }
    }

    @Test
    void selectionRuleViolationsAreZero() {
        assertEquals(0.0, wigner.w000(1, 1, 1));
        assertEquals(0.0, wigner.w000(2, 3, 4));
        assertEquals(0.0, wigner.w000(1, 1, 4));
        assertEquals(0.0, wigner.w000(5, 1, 2));
    }

    @Test
    void degreeOutOfRange_throws() {
        assertThrows(IllegalArgumentException.class, () -> wigner.w000(21, 1, 20));
        assertThrows(IllegalArgumentException.class, () -> wigner.w000(-1, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new LogFactorialWigner3jProvider(-1));
    }
}
