package io.github.yok.pcl.core.linearalgebra;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * EJML を用いて、一般の正方行列の逆行列を計算するクラスです。
 *
 * <p>
 * 逆行列の前に 2 ノルム条件数を求め、上限を超える場合は数値的な失敗として扱います。
 * </p>
 */
public final class EjmlMatrixInversionBackend implements MatrixInversionBackend {

    /**
     * 許容する条件数の上限です。
     */
    @Getter
    private final double maxConditionNumber;

    /**
     * 逆行列バックエンドを生成します。
     *
     * @param maxConditionNumber 許容する条件数の上限です（1 以上）
     * @throws IllegalArgumentException maxConditionNumber が 1 未満の場合に発生します
     */
    public EjmlMatrixInversionBackend(double maxConditionNumber) {
        Preconditions.checkArgument(maxConditionNumber >= 1.0, "条件数の上限は 1 以上が必要です: %s",
                maxConditionNumber);
        this.maxConditionNumber = maxConditionNumber;
    }

    /**
     * 一般の正方行列を逆行列にします。
     *
     * @param matrix 正方行列です（変更しません）
     * @return 逆行列と条件数です
     * @throws IllegalArgumentException matrix が null、または正方行列でない場合に発生します
     * @throws IllegalStateException 行列が特異、または悪条件の場合に発生します
     */
    @Override
    public InversionResult invert(DMatrixRMaj matrix) {
        Preconditions.checkArgument(matrix != null, "matrix は null 不可です");
        Preconditions.checkArgument(matrix.numRows == matrix.numCols && matrix.numRows > 0,
                "正方行列が必要です: %sx%s", matrix.numRows, matrix.numCols);

        if (MatrixFeatures_DDRM.hasUncountable(matrix)) {
            throw new IllegalStateException("行列に NaN または無限大が含まれています");
        }

        // SVD が入力を書き換える場合に備えてコピーを渡します。
        double condition = NormOps_DDRM.conditionP2(matrix.copy());
        // 条件数は非ゼロ行列なら 1 以上（零行列では 0 が返る）
        if (!Double.isFinite(condition) || condition < 1.0 || condition > maxConditionNumber) {
            throw new IllegalStateException("行列が特異または悪条件のため逆行列を計算できません: 条件数=" + condition
                    + "、上限=" + maxConditionNumber);
        }

        DMatrixRMaj inverse = new DMatrixRMaj(matrix.numRows, matrix.numCols);
        if (!CommonOps_DDRM.invert(matrix.copy(), inverse)
                || MatrixFeatures_DDRM.hasUncountable(inverse)) {
            throw new IllegalStateException("逆行列の計算に失敗しました（EJML）: 条件数=" + condition);
        }
        return new InversionResult(inverse, condition);
    }
}
