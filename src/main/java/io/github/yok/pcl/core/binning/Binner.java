package io.github.yok.pcl.core.binning;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 多重極ごとのベクトルや行列をバンドパワーへまとめるビニング演算子を作るクラスです。
 *
 * <p>
 * 窓関数や結合行列には依存しません。ビン幅を変えた場合は演算子を作り直してください。
 * </p>
 */
@Slf4j
public final class Binner {

    /**
     * 可変幅ビニングの開始多重極です（単極子と双極子を除きます）。
     */
    public static final int VARIABLE_BINNING_FIRST_ELL = 2;

    /**
     * 幅 lperBin の一様ビニング演算子を作ります。
     *
     * <p>
     * ℓ=0..lmax を先頭から幅 lperBin のブロックに分け、ブロックごとに平均演算子（1/lperBin）と和演算子（1）を設定します。 (lmax+1) が
     * lperBin で割り切れない場合、末尾の余りの多重極はどのビンにも含めません。 最初のビンの ℓ=0 は両方の演算子で重み 0 とします（単極子の除外）。
     * </p>
     *
     * @param lmax 最大多重極です（0 以上）
     * @param lperBin ビン幅です（1 以上 lmax+1 以下）
     * @return ビニング方式です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BinningScheme makeBins(int lmax, int lperBin) {
        Preconditions.checkArgument(lmax >= 0, "lmax は 0 以上が必要です: %s", lmax);
        Preconditions.checkArgument(lperBin >= 1 && lperBin <= lmax + 1,
                "ビン幅は 1 以上 lmax+1（%s）以下が必要です: %s", lmax + 1, lperBin);

        int nl = lmax + 1;
        int nbins = nl / lperBin;
        DMatrixRMaj bins = new DMatrixRMaj(nbins, nl);
        DMatrixRMaj binsNoWeight = new DMatrixRMaj(nbins, nl);

        double weight = 1.0 / lperBin;
        for (int b = 0; b < nbins; b++) {
            int lo = b * lperBin;
            for (int l = lo; l < lo + lperBin; l++) {
                bins.unsafe_set(b, l, weight);
                binsNoWeight.unsafe_set(b, l, 1.0);
            }
        }

        // 単極子を平均・和から外す
        bins.unsafe_set(0, 0, 0.0);
        binsNoWeight.unsafe_set(0, 0, 0.0);

        int dropped = nl - nbins * lperBin;
        if (dropped > 0) {
            log.warn("ビン幅で割り切れないため末尾の多重極をビニングから除外します。ℓ={}..{}、ビン幅={}", nl - dropped, lmax,
                    lperBin);
        }

        return new BinningScheme(bins, binsNoWeight, BinningScheme.weightedElls(bins));
    }

    /**
     * 可変幅のビニング行列（重み付き平均の演算子のみ）を作ります。
     *
     * <p>
     * ℓ0=2 から始め、幅 {@link VariableBinningType#widthAt} のビンを、次の境界が lmax+1 を超えるまで追加します。 各行の要素は
     * 1/(ビン幅) です。
     * </p>
     *
     * @param lmax 最大多重極です（0 以上）
     * @param type ビン幅の決め方（linear/sqrt）です
     * @param step 幅のパラメータです（1 以上）
     * @return Nbins×(lmax+1) のビニング行列です（ビンが一つも作れない場合は 0 行）
     * @throws IllegalArgumentException 未知の種別名、または引数が不正な場合に発生します
     */
    public DMatrixRMaj makeVariableBins(int lmax, String type, int step) {
        return makeVariableBins(lmax, VariableBinningType.fromName(type), step);
    }

    /**
     * 可変幅のビニング行列（重み付き平均の演算子のみ）を作ります。
     *
     * @param lmax 最大多重極です（0 以上）
     * @param type ビン幅の決め方です（null 不可）
     * @param step 幅のパラメータです（1 以上）
     * @return Nbins×(lmax+1) のビニング行列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public DMatrixRMaj makeVariableBins(int lmax, VariableBinningType type, int step) {
        Preconditions.checkArgument(lmax >= 0, "lmax は 0 以上が必要です: %s", lmax);
        Preconditions.checkNotNull(type, "type は null 不可です");
        Preconditions.checkArgument(step >= 1, "step は 1 以上が必要です: %s", step);

        int nl = lmax + 1;
        DMatrixRMaj bins = new DMatrixRMaj(nl, nl);

        int rows = 0;
        int l0 = VARIABLE_BINNING_FIRST_ELL;
        int l1 = l0 + type.widthAt(l0, step);
        while (l1 <= nl) {
            double weight = 1.0 / (l1 - l0);
            for (int l = l0; l < l1; l++) {
                bins.unsafe_set(rows, l, weight);
            }
            rows++;
            l0 = l1;
            l1 = l1 + type.widthAt(l1, step);
        }

        DMatrixRMaj trimmed = new DMatrixRMaj(rows, nl);
        System.arraycopy(bins.data, 0, trimmed.data, 0, rows * nl);

        log.debug("可変幅ビニングを作成しました。type={}、step={}、ビン数={}", type, step, rows);
        return trimmed;
    }
}
