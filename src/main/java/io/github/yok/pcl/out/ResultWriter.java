package io.github.yok.pcl.out;

import io.github.yok.pcl.core.decoupling.SpectrumDecoupler.DecouplingResult;

/**
 * デカップリング結果を出力する処理のインタフェースです。
 *
 * <p>
 * ビン幅をスキャンして計算することを前提とし、出力の命名規約に必要なビニングのラベルを受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * デカップリング結果を出力します。
     *
     * @param binningLabel ビニングを識別するラベル（一様ビン幅なら {@code 16}、可変幅なら {@code sqrt16} など）です
     * @param result デカップリング結果です
     * @param theoryBandpowers 理論スペクトルを畳み込んだバンドパワーです（理論スペクトルがない場合は null）
     */
    void write(String binningLabel, DecouplingResult result, double[] theoryBandpowers);
}
