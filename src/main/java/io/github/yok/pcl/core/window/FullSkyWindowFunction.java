package io.github.yok.pcl.core.window;

import com.google.common.base.Preconditions;

/**
 * 全天観測（マスクなし）に対応する窓関数です。
 *
 * <p>
 * W(0) = 4π（[∫dn Y*_00(n)]^2）、それ以外の ℓ では 0 を返します。 この窓関数から計算した結合行列は単位行列になるため、検証用にのみ使用します。
 * </p>
 */
public final class FullSkyWindowFunction implements WindowFunction {

    /**
     * ℓ=0 における窓関数の値 4π です。
     */
    public static final double MONOPOLE_VALUE = 4.0 * Math.PI;

    /**
     * 参照可能な多重極の個数です。
     */
    private final int size;

    /**
     * 全天窓関数を生成します。
     *
     * @param lmax 結合行列を計算する最大多重極です（0 以上）
     * @throws IllegalArgumentException lmax が負の場合に発生します
     */
    public FullSkyWindowFunction(int lmax) {
        Preconditions.checkArgument(lmax >= 0, "lmax は 0 以上が必要です: %s", lmax);
        this.size = TabulatedWindowFunction.requiredLength(lmax);
    }

    @Override
    public double valueAt(int l) {
        Preconditions.checkElementIndex(l, size, "窓関数の多重極 ℓ");
        return (l == 0) ? MONOPOLE_VALUE : 0.0;
    }

    @Override
    public int size() {
        return size;
    }
}
