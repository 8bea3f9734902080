package io.github.yok.pcl.core.wigner;

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 対数階乗の表を用いて Wigner 3j 記号 (l1 l2 l3; 0 0 0) を閉じた式で評価するクラスです。
 *
 * <p>
 * 2g = l1+l2+l3 として、
 * </p>
 *
 * <pre>
 *   (l1 l2 l3; 0 0 0) = (-1)^g * sqrt[(2g-2l1)! (2g-2l2)! (2g-2l3)! / (2g+1)!]
 *                       * g! / [(g-l1)! (g-l2)! (g-l3)!]
 * </pre>
 *
 * <p>
 * 階乗はオーバーフローを避けるため対数で保持し、生成時に一度だけ表を作ります。 三角不等式またはパリティを満たさない組には 0 を返します。
 * </p>
 */
@Slf4j
public final class LogFactorialWigner3jProvider implements Wigner3jProvider {

    /**
     * 評価可能な多重極の最大値です。
     */
    @Getter
    private final int maxDegree;

    /**
     * ln(n!) の表です（n = 0 .. 3·maxDegree+1）。
     */
    private final double[] logFactorial;

    /**
     * 評価器を生成し、対数階乗の表を事前計算します。
     *
     * @param maxDegree 評価可能な多重極の最大値です（0 以上）
     * @throws IllegalArgumentException maxDegree が負の場合に発生します
     */
    public LogFactorialWigner3jProvider(int maxDegree) {
        Preconditions.checkArgument(maxDegree >= 0, "maxDegree は 0 以上が必要です: %s", maxDegree);
        this.maxDegree = maxDegree;

        // 2g+1 ≤ 3·maxDegree+1 まで必要
        int n = 3 * maxDegree + 2;
        this.logFactorial = new double[n];
        for (int i = 1; i < n; i++) {
            logFactorial[i] = logFactorial[i - 1] + Math.log(i);
        }
        log.debug("対数階乗の表を作成しました。maxDegree={}、表の長さ={}", maxDegree, n);
    }

    /**
     * Wigner 3j 記号 (l1 l2 l3; 0 0 0) を返します。
     *
     * @param l1 第1多重極です
     * @param l2 第2多重極です
     * @param l3 第3多重極です
     * @return 3j 記号の値です（選択則を満たさない場合は 0）
     * @throws IllegalArgumentException 多重極が負、または maxDegree を超える場合に発生します
     */
    @Override
    public double w000(int l1, int l2, int l3) {
        checkDegree(l1);
        checkDegree(l2);
        checkDegree(l3);

        int twoG = l1 + l2 + l3;
        if ((twoG & 1) != 0 || l3 < Math.abs(l1 - l2) || l3 > l1 + l2) {
            return 0.0;
        }
        int g = twoG / 2;

        double logValue = 0.5 * (logFactorial[twoG - 2 * l1] + logFactorial[twoG - 2 * l2]
                + logFactorial[twoG - 2 * l3] - logFactorial[twoG + 1]) + logFactorial[g]
                - logFactorial[g - l1] - logFactorial[g - l2] - logFactorial[g - l3];

        double magnitude = Math.exp(logValue);
        return ((g & 1) == 0) ? magnitude : -magnitude;
    }

    /**
     * 多重極が評価可能な範囲にあるかを検査します。
     *
     * @param l 多重極です
     */
    private void checkDegree(int l) {
        Preconditions.checkArgument(l >= 0 && l <= maxDegree,
                "多重極は 0 以上 %s 以下が必要です: %s", maxDegree, l);
    }
}
