package io.github.yok.pcl.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 密な正方行列の逆行列を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや特異判定の方法を差し替えやすくするためのインタフェースです。 正則化や擬似逆行列へのフォールバックは行いません。
 * </p>
 */
public interface MatrixInversionBackend {

    /**
     * 一般の正方行列を逆行列にします。
     *
     * @param matrix 正方行列です（変更しません）
     * @return 逆行列と条件数です
     * @throws IllegalStateException 行列が特異、または数値的に悪条件の場合に発生します
     */
    InversionResult invert(DMatrixRMaj matrix);

    /**
     * 逆行列の計算結果を保持するクラスです。
     */
    @Value
    class InversionResult {

        /**
         * 逆行列です。
         */
        DMatrixRMaj inverse;

        /**
         * 元の行列の 2 ノルム条件数（最大特異値 / 最小特異値）です。
         */
        double conditionNumber;
    }
}
