package io.github.yok.pcl.core.window;

/**
 * 多重極 ℓ ごとの窓関数 W(ℓ) を提供するインタフェースです。
 *
 * <p>
 * マスク由来の表形式の窓関数と、全天（デバッグ用）の窓関数を差し替えやすくするための境界です。
 * </p>
 */
public interface WindowFunction {

    /**
     * 指定多重極の窓関数の値 W(ℓ) を返します。
     *
     * @param l 多重極です（0 以上 {@link #size()} 未満）
     * @return 窓関数の値です
     */
    double valueAt(int l);

    /**
     * 参照可能な多重極の個数（最大多重極 + 1）を返します。
     *
     * @return 参照可能な多重極の個数です
     */
    int size();
}
