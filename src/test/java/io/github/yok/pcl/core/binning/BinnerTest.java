package io.github.yok.pcl.core.binning;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.pcl.core.decoupling.MaskDeconvolution;
import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class BinnerTest {

    private static final double TOL = 1e-15;

    private final Binner binner = new Binner();

    @Test
    void uniformBinsHaveExpectedWeights() {
        BinningScheme s = binner.makeBins(9, 2);

        assertEquals(5, s.binCount());
        assertEquals(10, s.multipoleCount());

        DMatrixRMaj bins = s.getBins();
        DMatrixRMaj noWeight = s.getBinsNoWeight();
        for (int b = 0; b < 5; b++) {
            for (int l = 0; l < 10; l++) {
                boolean inBlock = l / 2 == b && l != 0;
                assertEquals(inBlock ? 0.5 : 0.0, bins.get(b, l), TOL, "b=" + b + ", l=" + l);
                assertEquals(inBlock ? 1.0 : 0.0, noWeight.get(b, l), TOL, "b=" + b + ", l=" + l);
            }
        }
    }

    @Test
    void monopoleIsExcludedFromFirstBin() {
        BinningScheme s = binner.makeBins(15, 4);

        assertEquals(0.0, s.getBins().get(0, 0));
        assertEquals(0.0, s.getBinsNoWeight().get(0, 0));
        assertEquals(0.25, s.getBins().get(0, 1), TOL);
    }

    @Test
    void binCentresAreWeightedMeanMultipoles() {
        BinningScheme s = binner.makeBins(9, 2);

        // 最初のビンは ℓ=1 だけが重み 1/2 を持つ
        assertArrayEquals(new double[] {0.5, 2.5, 4.5, 6.5, 8.5}, s.getBinnedElls(), 1e-12);
    }

    @Test
    void constantSpectrumIsPreservedOutsideFirstBin() {
        double c = 3.7;
        for (int lperBin : new int[] {1, 2, 3, 5, 7}) {
            BinningScheme s = binner.makeBins(20, lperBin);
            double[] cl = new double[21];
            Arrays.fill(cl, c);

            double[] cb = MaskDeconvolution.binSpectrum(s, cl);

            assertEquals(21 / lperBin, cb.length);
            assertEquals(c * (lperBin - 1) / lperBin, cb[0], 1e-12, "lperBin=" + lperBin);
            for (int b = 1; b < cb.length; b++) {
                assertEquals(c, cb[b], 1e-12, "lperBin=" + lperBin + ", b=" + b);
            }
        }
    }

    @Test
    void leftoverMultipolesAreDropped() {
        BinningScheme s = binner.makeBins(9, 3);

        assertEquals(3, s.binCount());
        for (int b = 0; b < 3; b++) {
            assertEquals(0.0, s.getBins().get(b, 9));
            assertEquals(0.0, s.getBinsNoWeight().get(b, 9));
        }
    }

    @Test
    void invalidBinWidth_throws() {
        assertThrows(IllegalArgumentException.class, () -> binner.makeBins(9, 0));
        assertThrows(IllegalArgumentException.class, () -> binner.makeBins(9, 11));
        assertThrows(IllegalArgumentException.class, () -> binner.makeBins(-1, 1));
    }

    @Test
    void linearVariableBinsStartAtQuadrupole() {
        DMatrixRMaj bins = binner.makeVariableBins(9, "linear", 3);

        assertEquals(2, bins.numRows);
        assertEquals(10, bins.numCols);
        double third = 1.0 / 3.0;
        assertArrayEquals(new double[] {0, 0, third, third, third, 0, 0, 0, 0, 0}, row(bins, 0),
                TOL);
        assertArrayEquals(new double[] {0, 0, 0, 0, 0, third, third, third, 0, 0}, row(bins, 1),
                TOL);
    }

    @Test
    void sqrtVariableBinsGrowWithMultipole() {
        DMatrixRMaj bins = binner.makeVariableBins(63, "sqrt", 2);

        // 幅 ceil(sqrt(4ℓ)+2): [2,7) [7,15) [15,25) [25,37) [37,52)
        int[] lower = {2, 7, 15, 25, 37};
        int[] upper = {7, 15, 25, 37, 52};
        assertEquals(lower.length, bins.numRows);
        for (int b = 0; b < lower.length; b++) {
            double[] r = row(bins, b);
            double width = upper[b] - lower[b];
            double sum = 0.0;
            for (int l = 0; l < r.length; l++) {
                boolean inBin = l >= lower[b] && l < upper[b];
                assertEquals(inBin ? 1.0 / width : 0.0, r[l], TOL, "b=" + b + ", l=" + l);
                sum += r[l];
            }
            assertEquals(1.0, sum, 1e-12);
        }
    }

    @Test
    void variableBinsTooWideForRangeAreEmpty() {
        DMatrixRMaj bins = binner.makeVariableBins(4, VariableBinningType.LINEAR, 8);

        assertEquals(0, bins.numRows);
        assertEquals(5, bins.numCols);
    }

    @Test
    void unknownVariableBinningType_throws() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> binner.makeVariableBins(32, "log", 4));

        assertTrue(ex.getMessage().contains("log"));
        assertThrows(IllegalArgumentException.class, () -> VariableBinningType.fromName(null));
        assertEquals(VariableBinningType.SQRT, VariableBinningType.fromName(" SQRT "));
    }

    @Test
    void nonPositiveStep_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> binner.makeVariableBins(32, VariableBinningType.LINEAR, 0));
    }

    @Test
    void averagingMatrixDerivesIndicatorAndCentres() {
        DMatrixRMaj bins = binner.makeVariableBins(9, "linear", 3);

        BinningScheme s = BinningScheme.fromAveragingMatrix(bins);

        assertArrayEquals(new double[] {0, 0, 1, 1, 1, 0, 0, 0, 0, 0},
                row(s.getBinsNoWeight(), 0), TOL);
        assertArrayEquals(new double[] {3.0, 6.0}, s.getBinnedElls(), 1e-12);
    }

    private static double[] row(DMatrixRMaj m, int r) {
        double[] out = new double[m.numCols];
        for (int c = 0; c < m.numCols; c++) {
            out[c] = m.get(r, c);
        }
        return out;
    }
}
