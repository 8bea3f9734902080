package io.github.yok.pcl.out;

import io.github.yok.pcl.core.decoupling.SpectrumDecoupler.DecouplingResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * デカップリング結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（16 はビニングのラベル）。
 * </p>
 *
 * <ul>
 * <li>{@code pcl_bandpowers_lperBin=16.csv}（bin, ell, bandpower[, theoryConvolved]）</li>
 * <li>{@code pcl_meta_lperBin=16.csv}（lmax、ビン数、Mbb の条件数など）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "pcl";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * 最大多重極です。
     */
    private final int lmax;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param lmax 最大多重極です（0 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, int lmax) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (lmax < 0) {
            throw new IllegalArgumentException("lmax は 0 以上を指定してください: " + lmax);
        }
        this.outputDir = Paths.get(outputDir);
        this.lmax = lmax;
    }

    /**
     * デカップリング結果を出力します。
     *
     * @param binningLabel ビニングを識別するラベルです
     * @param result デカップリング結果です
     * @param theoryBandpowers 理論スペクトルを畳み込んだバンドパワーです（null 可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String binningLabel, DecouplingResult result, double[] theoryBandpowers) {
        if (binningLabel == null || binningLabel.isEmpty()) {
            throw new IllegalArgumentException("binningLabel は必須です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        int nbins = result.getBandpowers().length;
        if (result.getBinnedElls().length != nbins) {
            throw new IllegalArgumentException("ビン中心とバンドパワーの長さが一致しません: "
                    + result.getBinnedElls().length + " != " + nbins);
        }
        if (theoryBandpowers != null && theoryBandpowers.length != nbins) {
            throw new IllegalArgumentException(
                    "理論バンドパワーの長さがビン数と一致しません: " + theoryBandpowers.length + " != " + nbins);
        }

        try {
            Files.createDirectories(outputDir);

            // 1) バンドパワー
            writeBandpowersCsv(binningLabel, result, theoryBandpowers);

            // 2) メタ（lmax、ビン数、条件数など）
            writeMetaCsv(binningLabel, result, theoryBandpowers != null);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * バンドパワーを出力します。
     *
     * @param binningLabel ビニングのラベルです
     * @param result デカップリング結果です
     * @param theoryBandpowers 理論バンドパワーです（null 可）
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeBandpowersCsv(String binningLabel, DecouplingResult result,
            double[] theoryBandpowers) throws IOException {

        Path file = outputDir.resolve(buildFileName("bandpowers", binningLabel));

        String[] header = (theoryBandpowers != null)
                ? new String[] {"bin", "ell", "bandpower", "theoryConvolved"}
                : new String[] {"bin", "ell", "bandpower"};

        double[] ells = result.getBinnedElls();
        double[] cb = result.getBandpowers();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(header)
                        .build().print(w)) {

            for (int b = 0; b < cb.length; b++) {
                if (theoryBandpowers != null) {
                    pr.printRecord(b, ells[b], cb[b], theoryBandpowers[b]);
                } else {
                    pr.printRecord(b, ells[b], cb[b]);
                }
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param binningLabel ビニングのラベルです
     * @param result デカップリング結果です
     * @param hasTheory 理論バンドパワーを出力したかどうかです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(String binningLabel, DecouplingResult result, boolean hasTheory)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", binningLabel));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("lmax", lmax);
            pr.printRecord("binning", binningLabel);
            pr.printRecord("nBins", result.getBandpowers().length);
            pr.printRecord("conditionNumber", result.getConditionNumber());
            pr.printRecord("theoryConvolved", hasTheory);
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code pcl_bandpowers_lperBin=16.csv}
     * </p>
     *
     * @param kind 量の識別子（bandpowers/meta）
     * @param binningLabel ビニングのラベルです
     * @return ファイル名です
     */
    private static String buildFileName(String kind, String binningLabel) {
        return FILE_HEAD + "_" + kind + "_lperBin=" + binningLabel + ".csv";
    }
}
