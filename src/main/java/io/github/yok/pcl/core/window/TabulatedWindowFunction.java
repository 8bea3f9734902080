package io.github.yok.pcl.core.window;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * 多重極ごとに与えられた窓関数の表を保持するクラスです。
 *
 * <p>
 * 結合行列の計算には ℓ3 ≤ 2·lmax までの値が必要なため、与えられた配列が短い場合は 長さ 2·lmax+1 まで 0 で右詰めします。 値の物理的な妥当性（非負性など）は検証しません。
 * </p>
 */
public final class TabulatedWindowFunction implements WindowFunction {

    /**
     * 0 埋め済みの窓関数の値です。
     */
    private final double[] values;

    /**
     * 窓関数の表を生成します。
     *
     * @param lmax 結合行列を計算する最大多重極です（0 以上）
     * @param windowValues ℓ=0 から並んだ窓関数の値です（null 不可）
     * @throws IllegalArgumentException lmax が負の場合に発生します
     * @throws NullPointerException windowValues が null の場合に発生します
     */
    public TabulatedWindowFunction(int lmax, double[] windowValues) {
        Preconditions.checkArgument(lmax >= 0, "lmax は 0 以上が必要です: %s", lmax);
        Preconditions.checkNotNull(windowValues, "windowValues は null 不可です");

        int required = requiredLength(lmax);
        this.values = Arrays.copyOf(windowValues, Math.max(required, windowValues.length));
    }

    /**
     * 最大多重極 lmax の結合行列に必要な窓関数の長さ（2·lmax+1）を返します。
     *
     * @param lmax 最大多重極です
     * @return 必要な長さです
     */
    public static int requiredLength(int lmax) {
        return 2 * lmax + 1;
    }

    /**
     * 指定多重極の窓関数の値を返します。
     *
     * @param l 多重極です
     * @return 窓関数の値です
     * @throws IndexOutOfBoundsException l が 0 埋め後の範囲外の場合に発生します
     */
    @Override
    public double valueAt(int l) {
        Preconditions.checkElementIndex(l, values.length, "窓関数の多重極 ℓ");
        return values[l];
    }

    @Override
    public int size() {
        return values.length;
    }
}
