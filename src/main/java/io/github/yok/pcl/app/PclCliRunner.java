package io.github.yok.pcl.app;

import io.github.yok.pcl.core.binning.Binner;
import io.github.yok.pcl.core.binning.BinningScheme;
import io.github.yok.pcl.core.binning.VariableBinningType;
import io.github.yok.pcl.core.decoupling.MaskDeconvolution;
import io.github.yok.pcl.core.decoupling.SpectrumDecoupler.DecouplingResult;
import io.github.yok.pcl.in.SpectrumReader;
import io.github.yok.pcl.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で pcl-decoupler を実行するクラスです。
 *
 * <p>
 * 観測パワースペクトルを読み込み、設定されたビン幅ごとにバンドパワーのデカップリングを行います。 理論パワースペクトルが指定されている場合は、同じビニングで畳み込んだ値も出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PclCliRunner implements CommandLineRunner {

    /**
     * pcl-decoupler の設定値（pcl.*）です。
     */
    private final PclProperties properties;

    /**
     * 多重極ごとの配列の読み込みロジックです。
     */
    private final SpectrumReader spectrumReader;

    /**
     * デカップリング器です（結合行列は生成時に計算済み）。
     */
    private final MaskDeconvolution maskDeconvolution;

    /**
     * 可変幅ビニングの生成器です。
     */
    private final Binner binner;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== pcl-decoupler start: decouple masked bandpowers ===");
        System.out.print(properties.toMultilineString());

        PclProperties.Spectrum spectrum = properties.getSpectrum();
        if (spectrum.getFile() == null || spectrum.getFile().isEmpty()) {
            throw new IllegalStateException("pcl.spectrum.file は必須です");
        }
        double[] cl = spectrumReader.read(spectrum.getFile(), spectrum.getColumn());

        // 理論スペクトルは任意
        PclProperties.Spectrum theory = properties.getTheory();
        double[] clt = (theory.getFile() == null || theory.getFile().isEmpty()) ? null
                : spectrumReader.read(theory.getFile(), theory.getColumn());

        PclProperties.Binning binning = properties.getBinning();
        if (binning.getMode() == PclProperties.Binning.Mode.VARIABLE) {
            PclProperties.Binning.Variable v = binning.getVariable();
            VariableBinningType type = VariableBinningType.fromName(v.getType());
            BinningScheme scheme = BinningScheme.fromAveragingMatrix(
                    binner.makeVariableBins(maskDeconvolution.getLmax(), type, v.getStep()));

            String label = type.name().toLowerCase(Locale.ROOT) + v.getStep();
            System.out.println("=== 可変幅ビニングでの計算 ===");
            maskDeconvolution.setBinning(scheme);
            report(label, maskDeconvolution.decouple(cl), clt);
            return;
        }

        List<Integer> binWidths = binning.getBinWidths();
        if (binWidths == null || binWidths.isEmpty()) {
            throw new IllegalStateException("pcl.binning.bin-widths は必須です（ビン幅の一覧を指定してください）");
        }

        // ビン幅ごとにデカップリングを実行
        for (int i = 0; i < binWidths.size(); i++) {
            Integer widthObj = binWidths.get(i);
            if (widthObj == null) {
                throw new IllegalStateException("pcl.binning.bin-widths に null が含まれています");
            }
            int lperBin = widthObj.intValue();

            System.out.println("=== ビン幅ごとの計算 ===");
            System.out.println("入力: lperBin=" + lperBin + "（step=" + (i + 1) + "/" + binWidths.size()
                    + "）");

            report(String.valueOf(lperBin), maskDeconvolution.decouple(cl, lperBin), clt);
        }
    }

    /**
     * 理論スペクトルを畳み込み、結果を出力して要約を表示します。
     *
     * @param label ビニングのラベルです
     * @param result デカップリング結果です
     * @param clt 理論スペクトルです（null 可）
     */
    private void report(String label, DecouplingResult result, double[] clt) {
        double[] theoryBandpowers = (clt != null) ? maskDeconvolution.convolveTheory(clt) : null;

        resultWriter.write(label, result, theoryBandpowers);

        double[] ells = result.getBinnedElls();
        double[] cb = result.getBandpowers();
        System.out.println("結果: ビン数=" + cb.length + ", Mbb 条件数=" + fmt3e(result.getConditionNumber()));
        for (int b = 0; b < cb.length; b++) {
            StringBuilder line = new StringBuilder("  ell=").append(fmt2(ells[b])).append(", Cb=")
                    .append(fmt3e(cb[b]));
            if (theoryBandpowers != null) {
                line.append(", Cb(theory)=").append(fmt3e(theoryBandpowers[b]));
            }
            System.out.println(line);
        }
    }

    /**
     * 数値を小数点以下2桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
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
