package io.github.yok.pcl.core.binning;

import java.util.Locale;

/**
 * 可変幅ビニングのビン幅の決め方です。
 */
public enum VariableBinningType {

    /**
     * 一定幅 step のビンです。
     */
    LINEAR("linear") {
        @Override
        int widthAt(int l, int step) {
            return step;
        }
    },

    /**
     * 幅 ceil(sqrt(4ℓ) + step) のビンです（ℓ とともに幅が広がります）。
     */
    SQRT("sqrt") {
        @Override
        int widthAt(int l, int step) {
            return (int) Math.ceil(Math.sqrt(4.0 * l) + step);
        }
    };

    /**
     * 設定ファイル上の名前です。
     */
    private final String configName;

    VariableBinningType(String configName) {
        this.configName = configName;
    }

    /**
     * ビンの下端 ℓ におけるビン幅を返します。
     *
     * @param l ビンの下端の多重極です
     * @param step 幅のパラメータです
     * @return ビン幅です
     */
    abstract int widthAt(int l, int step);

    /**
     * 設定上の名前（linear/sqrt、大文字小文字は区別しない）から種別を返します。
     *
     * @param name 種別名です
     * @return 種別です
     * @throws IllegalArgumentException 未知の種別名の場合に発生します
     */
    public static VariableBinningType fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (VariableBinningType t : values()) {
                if (t.configName.equals(key)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("未知のビニング種別です: " + name + "（linear/sqrt のいずれかを指定してください）");
    }
}
