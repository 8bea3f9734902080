package io.github.yok.pcl.core.coupling;

import com.google.common.base.Preconditions;
import io.github.yok.pcl.core.window.TabulatedWindowFunction;
import io.github.yok.pcl.core.window.WindowFunction;
import io.github.yok.pcl.core.wigner.Wigner3jProvider;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 窓関数から多重極の結合行列（mode-coupling matrix）M_{l1,l2} を構築するクラスです。
 *
 * <pre>
 *   M[l1,l2] = 1/(4π) * Σ_{l3} (2·l2+1)(2·l3+1) * (l1 l2 l3; 0 0 0)^2 * W(l3)
 * </pre>
 *
 * <p>
 * l3 は三角不等式 |l1-l2| ≤ l3 ≤ l1+l2 の範囲で、l1+l2+l3 が偶数のものだけを走査します。 |l1-l2| と l1+l2 は常に同じ偶奇なので、
 * 下端から 2 刻みで進めると奇パリティ項を評価せずに済みます。
 * </p>
 *
 * <p>
 * Σ_{l3} (2·l3+1)(...)^2 W(l3) の部分は l1 と l2 の入れ替えで不変なので、l1 ≤ l2 の組についてだけ計算し、 (2·l2+1) と (2·l1+1)
 * を掛けて両方の要素を埋めます。 M 自体は (2·l2+1) の因子のため一般には対称になりません。
 * </p>
 */
@Slf4j
public final class CouplingMatrixBuilder {

    /**
     * 結合行列を構築します。
     *
     * <p>
     * 計算量は O(lmax^3) です。窓関数ごとに一度だけ呼び出してください。
     * </p>
     *
     * @param lmax 最大多重極です（0 以上）
     * @param window 窓関数です（少なくとも 2·lmax+1 個の多重極を参照可能であること）
     * @param wigner Wigner 3j 記号の評価器です
     * @return (lmax+1)×(lmax+1) の結合行列です
     * @throws IllegalArgumentException lmax が負、または窓関数の長さが足りない場合に発生します
     * @throws NullPointerException window または wigner が null の場合に発生します
     */
    public DMatrixRMaj build(int lmax, WindowFunction window, Wigner3jProvider wigner) {
        Preconditions.checkArgument(lmax >= 0, "lmax は 0 以上が必要です: %s", lmax);
        Preconditions.checkNotNull(window, "window は null 不可です");
        Preconditions.checkNotNull(wigner, "wigner は null 不可です");
        int required = TabulatedWindowFunction.requiredLength(lmax);
        Preconditions.checkArgument(window.size() >= required,
                "窓関数は ℓ=0..2·lmax（%s 個）が必要です: size=%s", required, window.size());

        long start = System.nanoTime();
        int n = lmax + 1;
        DMatrixRMaj m = new DMatrixRMaj(n, n);
        double norm = 1.0 / (4.0 * Math.PI);

        for (int l1 = 0; l1 <= lmax; l1++) {
            for (int l2 = l1; l2 <= lmax; l2++) {
                double s = 0.0;
                // l1+l2+l3 が偶数になる l3 だけを 2 刻みで走査
                for (int l3 = l2 - l1; l3 <= l1 + l2; l3 += 2) {
                    double w = wigner.w000(l1, l2, l3);
                    s += (2 * l3 + 1) * w * w * window.valueAt(l3);
                }
                m.unsafe_set(l1, l2, (2 * l2 + 1) * s * norm);
                if (l1 != l2) {
                    m.unsafe_set(l2, l1, (2 * l1 + 1) * s * norm);
                }
            }
        }

        log.info("結合行列を計算しました。lmax={}、経過時間={} ms", lmax,
                (System.nanoTime() - start) / 1_000_000L);
        return m;
    }
}
