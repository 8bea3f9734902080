package io.github.yok.pcl.core.wigner;

/**
 * 磁気量子数がすべて 0 の Wigner 3j 記号 (l1 l2 l3; 0 0 0) を評価するインタフェースです。
 *
 * <p>
 * 呼び出し側は三角不等式 |l1-l2| ≤ l3 ≤ l1+l2 と偶パリティ（l1+l2+l3 が偶数）を満たす組だけを渡します。 それ以外の組の寄与は 0
 * として扱い、この関数を呼び出しません。
 * </p>
 */
@FunctionalInterface
public interface Wigner3jProvider {

    /**
     * Wigner 3j 記号 (l1 l2 l3; 0 0 0) を返します。
     *
     * @param l1 第1多重極です（0 以上）
     * @param l2 第2多重極です（0 以上）
     * @param l3 第3多重極です（0 以上）
     * @return 3j 記号の値です
     */
    double w000(int l1, int l2, int l3);
}
