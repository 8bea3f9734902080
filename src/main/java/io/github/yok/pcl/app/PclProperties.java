package io.github.yok.pcl.app;

import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * pcl-decoupler の設定値（pcl.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "pcl")
public class PclProperties {

    /**
     * 結合行列を計算する最大多重極です。
     */
    @Min(0)
    private int lmax = 64;

    /**
     * 窓関数の入力設定です。
     */
    @Valid
    private Window window = new Window();

    /**
     * 観測パワースペクトルの入力設定です。
     */
    @Valid
    private Spectrum spectrum = new Spectrum();

    /**
     * 理論パワースペクトルの入力設定です（任意）。
     */
    @Valid
    private Spectrum theory = new Spectrum();

    /**
     * ビニング設定です。
     */
    @Valid
    private Binning binning = new Binning();

    /**
     * デカップリング（逆行列）の設定です。
     */
    @Valid
    private Decoupling decoupling = new Decoupling();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "pcl")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Window w = getWindow();
        Spectrum s = getSpectrum();
        Spectrum t = getTheory();
        Binning b = getBinning();
        Decoupling d = getDecoupling();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        sb.append("  lmax: ").append(getLmax()).append(nl);

        appendSection(sb, nl, "window",
                // file: 窓関数 CSV のパス
                "file", w.getFile(),
                // column: 窓関数の列名
                "column", w.getColumn(),
                // fullSky: 全天（検証用）の窓関数を使うかどうか
                "fullSky", w.isFullSky());

        appendSection(sb, nl, "spectrum",
                // file: 観測パワースペクトル CSV のパス
                "file", s.getFile(),
                // column: 値の列名
                "column", s.getColumn());

        appendSection(sb, nl, "theory",
                // file: 理論パワースペクトル CSV のパス（未指定なら畳み込みを行わない）
                "file", t.getFile(),
                // column: 値の列名
                "column", t.getColumn());

        appendSection(sb, nl, "binning",
                // mode: UNIFORM（一様幅）/VARIABLE（可変幅）
                "mode", b.getMode(),
                // binWidths: スキャンする一様ビン幅の一覧
                "binWidths", b.getBinWidths(),
                // variable.type: 可変幅ビニングの種別（linear/sqrt）
                "variable.type", b.getVariable().getType(),
                // variable.step: 可変幅ビニングの幅パラメータ
                "variable.step", b.getVariable().getStep());

        appendSection(sb, nl, "decoupling",
                // maxConditionNumber: Mbb の条件数の上限
                "maxConditionNumber", d.getMaxConditionNumber());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Window {

        /**
         * 窓関数 CSV のパスです（ell 列と値の列を持つこと）。
         */
        private String file;

        /**
         * 窓関数の列名です。
         */
        private String column = "window";

        /**
         * 全天の窓関数（W(0)=4π、それ以外 0）を使うかどうかです。
         *
         * <p>
         * true の場合、結合行列は単位行列になります。検証用で、{@code file} は読み込みません。
         * </p>
         */
        private boolean fullSky = false;
    }

    @Data
    public static class Spectrum {

        /**
         * パワースペクトル CSV のパスです（ell 列と値の列を持つこと）。
         */
        private String file;

        /**
         * 値の列名です。
         */
        private String column = "cl";
    }

    @Data
    public static class Binning {

        /**
         * ビニングの方式です。
         */
        @NotNull
        private Mode mode = Mode.UNIFORM;

        /**
         * スキャンする一様ビン幅（lperBin）の一覧です。
         */
        @NotEmpty
        private List<Integer> binWidths = List.of(16);

        /**
         * 可変幅ビニングの設定です。
         */
        @Valid
        private Variable variable = new Variable();

        public enum Mode {
            UNIFORM, VARIABLE
        }

        @Data
        public static class Variable {

            /**
             * 可変幅ビニングの種別（linear/sqrt）です。
             */
            private String type = "linear";

            /**
             * 幅パラメータです（linear では幅そのもの、sqrt では ceil(sqrt(4ℓ)+step) の step）。
             */
            @Min(1)
            private int step = 16;
        }
    }

    @Data
    public static class Decoupling {

        /**
         * Mbb の 2 ノルム条件数の上限です。
         *
         * <p>
         * 超えた場合は数値的な失敗として扱います。ビン幅を広げると改善することが多いです。
         * </p>
         */
        private double maxConditionNumber = 1e12;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
