package io.github.yok.pcl.in;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 多重極ごとの値を CSV から読み込むクラスです。
 *
 * <p>
 * ヘッダ行を必須とし、{@code ell} 列と値の列を持つ形式を読み込みます。 {@code ell} は 0,1,2,... と欠番なく並んでいる必要があります。
 * </p>
 *
 * <pre>
 * ell,cl
 * 0,0.0
 * 1,0.0
 * 2,1.25e-10
 * </pre>
 */
@Slf4j
public final class CsvSpectrumReader implements SpectrumReader {

    /**
     * 多重極の列名です。
     */
    public static final String ELL_COLUMN = "ell";

    /**
     * 指定ファイルの指定列を、ℓ=0 から並んだ配列として読み込みます。
     *
     * @param file 入力ファイルのパスです
     * @param column 値の列名です
     * @return ℓ=0,1,2,... の値の配列です
     * @throws IllegalArgumentException 引数や CSV の内容が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    @Override
    public double[] read(String file, String column) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("入力ファイルのパスは必須です");
        }
        if (column == null || column.isEmpty()) {
            throw new IllegalArgumentException("列名は必須です");
        }

        Path path = Paths.get(file);
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                        .setSkipHeaderRecord(true).setIgnoreSurroundingSpaces(true)
                        .setIgnoreEmptyLines(true).build().parse(r)) {

            Map<String, Integer> header = parser.getHeaderMap();
            if (!header.containsKey(ELL_COLUMN)) {
                throw new IllegalArgumentException(ELL_COLUMN + " 列がありません: " + path);
            }
            if (!header.containsKey(column)) {
                throw new IllegalArgumentException(column + " 列がありません: " + path);
            }

            List<CSVRecord> records = parser.getRecords();
            double[] values = new double[records.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = parseRow(records.get(i), i, column, path);
            }
            log.info("CSV を読み込みました。file={}、列={}、件数={}", path, column, values.length);
            return values;

        } catch (IOException e) {
            throw new IllegalStateException("CSV の読み込みに失敗しました: " + path, e);
        }
    }

    /**
     * 1 行を検査して値を返します。
     *
     * @param rec CSV の行です
     * @param expected この行に期待する ℓ です
     * @param column 値の列名です
     * @param path 入力ファイルのパス（エラーメッセージ用）です
     * @return 値です
     * @throws IllegalArgumentException ℓ が欠番、または数値として解釈できない場合に発生します
     */
    private static double parseRow(CSVRecord rec, int expected, String column, Path path) {
        try {
            long ell = Long.parseLong(rec.get(ELL_COLUMN));
            if (ell != expected) {
                throw new IllegalArgumentException("ℓ は 0 から欠番なく並べてください: 期待値=" + expected
                        + "、実際=" + ell + "（" + path + "）");
            }
            return Double.parseDouble(rec.get(column));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "数値として解釈できません: ℓ=" + expected + "（" + path + "）", e);
        }
    }
}
