package io.github.yok.pcl.core.binning;

import com.google.common.base.Preconditions;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 多重極ごとの量をバンドパワーへまとめる二つのビニング演算子と、ビン中心の多重極を保持するクラスです。
 *
 * <p>
 * 二つの演算子は同じビン境界を共有します。
 * </p>
 */
@Value
public class BinningScheme {

    /**
     * 重み付き平均の演算子（Nbins×(lmax+1)、各行の和は 1）です。
     */
    DMatrixRMaj bins;

    /**
     * 重みなしの和の演算子（Nbins×(lmax+1)、各行は 0/1 の指示関数）です。
     */
    DMatrixRMaj binsNoWeight;

    /**
     * ビンごとの重み付き平均の多重極（ビン中心）です。
     */
    double[] binnedElls;

    /**
     * ビン数を返します。
     *
     * @return ビン数です
     */
    public int binCount() {
        return bins.numRows;
    }

    /**
     * 演算子の列数（lmax+1）を返します。
     *
     * @return 多重極の個数です
     */
    public int multipoleCount() {
        return bins.numCols;
    }

    /**
     * 演算子とビン中心を複製したビニング方式を返します。
     *
     * @return 複製です
     */
    public BinningScheme copy() {
        return new BinningScheme(bins.copy(), binsNoWeight.copy(), binnedElls.clone());
    }

    /**
     * 重み付き平均の演算子だけから、重みなしの演算子とビン中心を導出します。
     *
     * <p>
     * 可変幅ビニング（{@link Binner#makeVariableBins}）の結果をデカップリングに用いる場合に使用します。 重みが 0 でない要素を 1
     * とした指示関数を重みなしの演算子とします。
     * </p>
     *
     * @param bins 重み付き平均の演算子です（null 不可、1 行以上）
     * @return ビニング方式です
     * @throws IllegalArgumentException bins が空の場合に発生します
     */
    public static BinningScheme fromAveragingMatrix(DMatrixRMaj bins) {
        Preconditions.checkNotNull(bins, "bins は null 不可です");
        Preconditions.checkArgument(bins.numRows > 0 && bins.numCols > 0,
                "bins は 1 行 1 列以上が必要です: %sx%s", bins.numRows, bins.numCols);

        DMatrixRMaj noWeight = new DMatrixRMaj(bins.numRows, bins.numCols);
        for (int b = 0; b < bins.numRows; b++) {
            for (int l = 0; l < bins.numCols; l++) {
                if (bins.unsafe_get(b, l) != 0.0) {
                    noWeight.unsafe_set(b, l, 1.0);
                }
            }
        }
        return new BinningScheme(bins, noWeight, weightedElls(bins));
    }

    /**
     * 各ビンの重み付き平均の多重極 Σ_ℓ bins[b,ℓ]·ℓ を返します。
     *
     * @param bins 重み付き平均の演算子です
     * @return ビン中心の多重極です
     */
    static double[] weightedElls(DMatrixRMaj bins) {
        double[] ells = new double[bins.numRows];
        for (int b = 0; b < bins.numRows; b++) {
            double s = 0.0;
            for (int l = 0; l < bins.numCols; l++) {
                s += bins.unsafe_get(b, l) * l;
            }
            ells[b] = s;
        }
        return ells;
    }
}
