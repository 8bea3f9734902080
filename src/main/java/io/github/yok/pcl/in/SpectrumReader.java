package io.github.yok.pcl.in;

/**
 * 多重極ごとの配列（窓関数・パワースペクトル）を読み込む処理のインタフェースです。
 */
public interface SpectrumReader {

    /**
     * 指定ファイルの指定列を、ℓ=0 から並んだ配列として読み込みます。
     *
     * @param file 入力ファイルのパスです
     * @param column 値の列名です
     * @return ℓ=0,1,2,... の値の配列です
     */
    double[] read(String file, String column);
}
