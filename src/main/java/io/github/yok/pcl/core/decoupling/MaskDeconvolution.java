package io.github.yok.pcl.core.decoupling;

import com.google.common.base.Preconditions;
import io.github.yok.pcl.core.binning.BinningScheme;
import io.github.yok.pcl.core.binning.Binner;
import io.github.yok.pcl.core.coupling.CouplingMatrixBuilder;
import io.github.yok.pcl.core.linearalgebra.MatrixInversionBackend;
import io.github.yok.pcl.core.linearalgebra.MatrixInversionBackend.InversionResult;
import io.github.yok.pcl.core.window.WindowFunction;
import io.github.yok.pcl.core.wigner.Wigner3jProvider;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 擬似パワースペクトル（pseudo-Cl）の多重極結合を取り除くクラスです。
 *
 * <p>
 * 生成時に結合行列 M を一度だけ計算して保持し、ビニングごとに Mbb = B·M·B0^T（B は平均演算子、B0 は重みなしの和演算子）と その逆行列を作り直します。
 * デカップリング済みバンドパワーは行ベクトルとして Cb·Mbb^-1 で求めます。
 * </p>
 *
 * <p>
 * ビニング関連の状態はインスタンスごとに保持するため、{@code decouple}/{@code convolveTheory} の一連の呼び出しの間は 一つの呼び出し元が占有してください。
 * </p>
 */
@Slf4j
public final class MaskDeconvolution implements SpectrumDecoupler {

    /**
     * ビニングの状態です。
     */
    public enum BinningState {
        /**
         * ビニング未設定（逆行列なし）です。
         */
        UNSET,
        /**
         * ビニング設定済み（Mbb の逆行列を保持）です。
         */
        READY
    }

    /**
     * 最大多重極です。
     */
    @Getter
    private final int lmax;

    /**
     * 窓関数です。
     */
    @Getter
    private final WindowFunction window;

    /**
     * (lmax+1)×(lmax+1) の結合行列 M です。
     */
    private final DMatrixRMaj couplingMatrix;

    /**
     * ビニング演算子を作るコンポーネントです。
     */
    private final Binner binner;

    /**
     * Mbb の逆行列を計算するバックエンドです。
     */
    private final MatrixInversionBackend inversionBackend;

    /**
     * 現在のビニングの状態です。
     */
    @Getter
    private BinningState binningState = BinningState.UNSET;

    /**
     * 現在の一様ビン幅です（可変幅ビニングまたは未設定の場合は 0）。
     */
    @Getter
    private int lperBin;

    /**
     * 現在のビニング方式です。
     */
    private BinningScheme binning;

    /**
     * ビニングした結合行列 Mbb です。
     */
    private DMatrixRMaj binnedCouplingMatrix;

    /**
     * Mbb の逆行列です。
     */
    private DMatrixRMaj binnedCouplingMatrixInverse;

    /**
     * Mbb の条件数です。
     */
    @Getter
    private double conditionNumber = Double.NaN;

    /**
     * 結合行列を計算してデカップリング器を生成します。
     *
     * @param lmax 最大多重極です（0 以上）
     * @param window 窓関数です（null 不可）
     * @param wigner Wigner 3j 記号の評価器です（null 不可）
     * @param couplingMatrixBuilder 結合行列の構築器です（null 不可）
     * @param binner ビニング演算子の生成器です（null 不可）
     * @param inversionBackend 逆行列バックエンドです（null 不可）
     * @throws IllegalArgumentException lmax が負、または窓関数の長さが足りない場合に発生します
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public MaskDeconvolution(int lmax, WindowFunction window, Wigner3jProvider wigner,
            CouplingMatrixBuilder couplingMatrixBuilder, Binner binner,
            MatrixInversionBackend inversionBackend) {
        Preconditions.checkArgument(lmax >= 0, "lmax は 0 以上が必要です: %s", lmax);
        Preconditions.checkNotNull(couplingMatrixBuilder, "couplingMatrixBuilder は null 不可です");
        this.lmax = lmax;
        this.window = Preconditions.checkNotNull(window, "window は null 不可です");
        this.binner = Preconditions.checkNotNull(binner, "binner は null 不可です");
        this.inversionBackend =
                Preconditions.checkNotNull(inversionBackend, "inversionBackend は null 不可です");

        log.info("結合行列を計算しています。lmax={}", lmax);
        this.couplingMatrix = couplingMatrixBuilder.build(lmax, window, wigner);
    }

    /**
     * 結合行列 M のコピーを返します。
     *
     * @return 結合行列のコピーです
     */
    public DMatrixRMaj getCouplingMatrix() {
        return couplingMatrix.copy();
    }

    /**
     * 現在のビニング方式のコピーを返します。
     *
     * @return ビニング方式のコピーです（未設定の場合は null）
     */
    public BinningScheme getBinning() {
        return (binning != null) ? binning.copy() : null;
    }

    /**
     * 現在のビニングの Mbb のコピーを返します。
     *
     * @return Mbb のコピーです
     * @throws IllegalStateException ビニングが未設定の場合に発生します
     */
    public DMatrixRMaj getBinnedCouplingMatrix() {
        checkReady("Mbb の取得");
        return binnedCouplingMatrix.copy();
    }

    /**
     * 現在のビニングの Mbb の逆行列のコピーを返します。
     *
     * @return Mbb^-1 のコピーです
     * @throws IllegalStateException ビニングが未設定の場合に発生します
     */
    public DMatrixRMaj getBinnedCouplingMatrixInverse() {
        checkReady("Mbb^-1 の取得");
        return binnedCouplingMatrixInverse.copy();
    }

    /**
     * 幅 lperBin の一様ビニングを設定し、Mbb とその逆行列を作り直します。
     *
     * @param lperBin ビン幅です（1 以上 lmax+1 以下）
     * @throws IllegalArgumentException ビン幅が不正な場合に発生します
     * @throws IllegalStateException Mbb が特異または悪条件の場合に発生します
     */
    public void setBinning(int lperBin) {
        applyBinning(binner.makeBins(lmax, lperBin), lperBin);
    }

    /**
     * 任意のビニング方式（可変幅ビニングなど）を設定し、Mbb とその逆行列を作り直します。
     *
     * @param scheme ビニング方式です（列数は lmax+1）
     * @throws IllegalArgumentException 列数が lmax+1 でない場合に発生します
     * @throws IllegalStateException Mbb が特異または悪条件の場合に発生します
     */
    public void setBinning(BinningScheme scheme) {
        Preconditions.checkNotNull(scheme, "scheme は null 不可です");
        Preconditions.checkArgument(scheme.multipoleCount() == lmax + 1,
                "ビニング行列の列数は lmax+1（%s）が必要です: %s", lmax + 1, scheme.multipoleCount());
        applyBinning(scheme, 0);
    }

    /**
     * ビニングを適用し、状態を更新します。
     *
     * <p>
     * 逆行列の計算に失敗した場合は状態を未設定に戻し、古い逆行列を残しません。
     * </p>
     *
     * @param scheme ビニング方式です
     * @param width 一様ビン幅（可変幅の場合は 0）です
     */
    private void applyBinning(BinningScheme scheme, int width) {
        resetBinning();

        DMatrixRMaj mbb = binMatrix(scheme, couplingMatrix);
        InversionResult inv = inversionBackend.invert(mbb);

        this.binning = scheme;
        this.lperBin = width;
        this.binnedCouplingMatrix = mbb;
        this.binnedCouplingMatrixInverse = inv.getInverse();
        this.conditionNumber = inv.getConditionNumber();
        this.binningState = BinningState.READY;

        log.info("ビニングを設定しました。ビン幅={}、ビン数={}、Mbb の条件数={}",
                (width > 0) ? width : "可変", scheme.binCount(), fmt3e(conditionNumber));
    }

    /**
     * ビニングの状態を未設定に戻します。
     */
    private void resetBinning() {
        this.binningState = BinningState.UNSET;
        this.binning = null;
        this.lperBin = 0;
        this.binnedCouplingMatrix = null;
        this.binnedCouplingMatrixInverse = null;
        this.conditionNumber = Double.NaN;
    }

    /**
     * 観測パワースペクトルをビン幅 lperBin でデカップリングします。
     *
     * <p>
     * ビン幅が現在の設定と異なる場合（または未設定の場合）だけビニングを作り直します。
     * </p>
     *
     * @param cl ℓ=0..lmax のパワースペクトルです（長さ lmax+1）
     * @param lperBin ビン幅です
     * @return ビン中心の多重極とデカップリング済みバンドパワーです
     * @throws IllegalArgumentException cl の長さが lmax+1 でない、またはビン幅が 1 未満か lmax+1 を超える場合に発生します
     * @throws IllegalStateException Mbb が特異または悪条件の場合に発生します
     */
    @Override
    public DecouplingResult decouple(double[] cl, int lperBin) {
        checkSpectrumLength(cl, "C_l");
        // 可変幅ビニングでは lperBin=0 を保持するため、キャッシュ判定の前に検査
        Preconditions.checkArgument(lperBin >= 1, "ビン幅は 1 以上が必要です: %s", lperBin);
        if (binningState != BinningState.READY || this.lperBin != lperBin) {
            setBinning(lperBin);
        }
        return decouple(cl);
    }

    /**
     * 観測パワースペクトルを現在のビニングでデカップリングします。
     *
     * @param cl ℓ=0..lmax のパワースペクトルです（長さ lmax+1）
     * @return ビン中心の多重極とデカップリング済みバンドパワーです
     * @throws IllegalArgumentException cl の長さが lmax+1 でない場合に発生します
     * @throws IllegalStateException ビニングが未設定の場合に発生します
     */
    public DecouplingResult decouple(double[] cl) {
        checkSpectrumLength(cl, "C_l");
        checkReady("デカップリング");

        double[] cb = binSpectrum(binning, cl);
        double[] decoupled = decoupleBandpowers(binnedCouplingMatrixInverse, cb);
        return new DecouplingResult(binning.getBinnedElls().clone(), decoupled, conditionNumber);
    }

    /**
     * 理論パワースペクトルに結合行列を掛け、現在のビニングでビニングとデカップリングを行います。
     *
     * <p>
     * 結合の影響が正しく取り除けていれば、理論値のビン平均に近い値を返します。
     * </p>
     *
     * @param clt ℓ=0..lmax の理論パワースペクトルです（長さ lmax+1）
     * @return デカップリング済みの理論バンドパワーです
     * @throws IllegalArgumentException clt の長さが lmax+1 でない場合に発生します
     * @throws IllegalStateException 事前にデカップリング（ビニング設定）が行われていない場合に発生します
     */
    @Override
    public double[] convolveTheory(double[] clt) {
        checkReady("理論スペクトルの畳み込み");
        checkSpectrumLength(clt, "理論 C_l");

        DMatrixRMaj coupled = new DMatrixRMaj(lmax + 1, 1);
        CommonOps_DDRM.mult(couplingMatrix, new DMatrixRMaj(clt), coupled);
        return decoupleBandpowers(binnedCouplingMatrixInverse,
                binSpectrum(binning, coupled.getData()));
    }

    /**
     * 結合行列をビニングします（Mbb = B·M·B0^T）。
     *
     * @param scheme ビニング方式です
     * @param m (lmax+1)×(lmax+1) の行列です
     * @return Nbins×Nbins の行列です
     */
    public static DMatrixRMaj binMatrix(BinningScheme scheme, DMatrixRMaj m) {
        DMatrixRMaj bm = new DMatrixRMaj(scheme.binCount(), m.numCols);
        CommonOps_DDRM.mult(scheme.getBins(), m, bm);
        DMatrixRMaj mbb = new DMatrixRMaj(scheme.binCount(), scheme.binCount());
        CommonOps_DDRM.multTransB(bm, scheme.getBinsNoWeight(), mbb);
        return mbb;
    }

    /**
     * パワースペクトルを平均演算子でビニングします（Cb = B·Cl）。
     *
     * @param scheme ビニング方式です
     * @param cl 長さ lmax+1 のパワースペクトルです
     * @return 長さ Nbins のバンドパワーです
     */
    public static double[] binSpectrum(BinningScheme scheme, double[] cl) {
        DMatrixRMaj cb = new DMatrixRMaj(scheme.binCount(), 1);
        CommonOps_DDRM.mult(scheme.getBins(), new DMatrixRMaj(cl), cb);
        return cb.getData();
    }

    /**
     * バンドパワーを行ベクトルとして逆行列に掛けます（Cb·Mbb^-1）。
     *
     * <p>
     * Mbb^-1·Cb とは Mbb^-1 が対称でない限り一致しません。
     * </p>
     *
     * @param inverse Mbb^-1 です
     * @param cb バンドパワーです
     * @return デカップリング済みバンドパワーです
     */
    public static double[] decoupleBandpowers(DMatrixRMaj inverse, double[] cb) {
        // (Cb·Mbb^-1)^T = (Mbb^-1)^T·Cb^T
        DMatrixRMaj out = new DMatrixRMaj(inverse.numCols, 1);
        CommonOps_DDRM.multTransA(inverse, new DMatrixRMaj(cb), out);
        return out.getData();
    }

    /**
     * ビニングが設定済みであることを検査します。
     *
     * @param operation 実行しようとした操作の名前です
     * @throws IllegalStateException ビニングが未設定の場合に発生します
     */
    private void checkReady(String operation) {
        Preconditions.checkState(binningState == BinningState.READY,
                "%s の前にデカップリング（ビニングの設定）を実行してください", operation);
    }

    /**
     * パワースペクトルの長さが lmax+1 であることを検査します。
     *
     * @param spectrum パワースペクトルです
     * @param name エラーメッセージに使う名前です
     * @throws IllegalArgumentException 長さが一致しない場合に発生します
     */
    private void checkSpectrumLength(double[] spectrum, String name) {
        Preconditions.checkArgument(spectrum != null, "%s は null 不可です", name);
        Preconditions.checkArgument(spectrum.length == lmax + 1,
                "%s は ℓ=0..lmax（長さ %s）で与えてください: length=%s", name, lmax + 1, spectrum.length);
    }

    /**
     * 数値を指数表記（有効数字3桁）の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt3e(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }
}
