package io.github.yok.pcl.core.decoupling;

import lombok.Value;

/**
 * マスクによる多重極間の結合を、ビニングしたバンドパワー上で取り除くインタフェースです。
 *
 * <p>
 * {@link #convolveTheory(double[])} は直前の {@link #decouple(double[], int)} と同じビニングの逆行列を再利用します。
 * </p>
 */
public interface SpectrumDecoupler {

    /**
     * 観測パワースペクトルをビン幅 lperBin でビニングし、結合を取り除いたバンドパワーを返します。
     *
     * @param cl ℓ=0..lmax のパワースペクトルです（長さ lmax+1）
     * @param lperBin ビン幅です
     * @return ビン中心の多重極とデカップリング済みバンドパワーです
     */
    DecouplingResult decouple(double[] cl, int lperBin);

    /**
     * 理論パワースペクトルに結合行列を掛け、現在のビニングでビニングとデカップリングを行います。
     *
     * @param clt ℓ=0..lmax の理論パワースペクトルです（長さ lmax+1）
     * @return デカップリング済みの理論バンドパワーです
     */
    double[] convolveTheory(double[] clt);

    /**
     * デカップリングの結果を表すクラスです。
     */
    @Value
    class DecouplingResult {

        /**
         * ビン中心の多重極（昇順）です。
         */
        double[] binnedElls;

        /**
         * デカップリング済みのバンドパワーです。
         */
        double[] bandpowers;

        /**
         * ビニングした結合行列 Mbb の 2 ノルム条件数です。
         */
        double conditionNumber;
    }
}
