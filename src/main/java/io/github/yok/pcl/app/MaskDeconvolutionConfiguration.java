package io.github.yok.pcl.app;

import io.github.yok.pcl.core.binning.Binner;
import io.github.yok.pcl.core.coupling.CouplingMatrixBuilder;
import io.github.yok.pcl.core.decoupling.MaskDeconvolution;
import io.github.yok.pcl.core.linearalgebra.EjmlMatrixInversionBackend;
import io.github.yok.pcl.core.linearalgebra.MatrixInversionBackend;
import io.github.yok.pcl.core.window.FullSkyWindowFunction;
import io.github.yok.pcl.core.window.TabulatedWindowFunction;
import io.github.yok.pcl.core.window.WindowFunction;
import io.github.yok.pcl.core.wigner.LogFactorialWigner3jProvider;
import io.github.yok.pcl.core.wigner.Wigner3jProvider;
import io.github.yok.pcl.in.CsvSpectrumReader;
import io.github.yok.pcl.in.SpectrumReader;
import io.github.yok.pcl.out.CsvResultWriter;
import io.github.yok.pcl.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 窓関数 + Wigner 3j + 結合行列 + デカップリングの Bean 定義を行う設定クラスです。
 *
 * <p>
 * 結合行列は {@link MaskDeconvolution} の生成時に一度だけ計算され、ビン幅のスキャン全体で再利用されます。
 * </p>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MaskDeconvolutionConfiguration {

    /**
     * pcl-decoupler の設定値（pcl.*）です。
     */
    private final PclProperties p;

    /**
     * 多重極ごとの配列の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public SpectrumReader spectrumReader() {
        return new CsvSpectrumReader();
    }

    /**
     * 窓関数を生成します。
     *
     * @param reader 読み込みロジックです
     * @return 窓関数です
     * @throws IllegalStateException fullSky=false で window.file が未指定の場合に発生します
     */
    @Bean
    public WindowFunction windowFunction(SpectrumReader reader) {
        PclProperties.Window w = p.getWindow();
        if (w.isFullSky()) {
            log.warn("全天の窓関数を使用します（検証用）。結合行列は単位行列になります");
            return new FullSkyWindowFunction(p.getLmax());
        }
        if (w.getFile() == null || w.getFile().isEmpty()) {
            throw new IllegalStateException("pcl.window.file は必須です（検証用なら pcl.window.full-sky=true）");
        }
        return new TabulatedWindowFunction(p.getLmax(), reader.read(w.getFile(), w.getColumn()));
    }

    /**
     * Wigner 3j 記号の評価器を生成します。
     *
     * <p>
     * 結合行列では l3 ≤ 2·lmax まで評価するため、最大次数は 2·lmax とします。
     * </p>
     *
     * @return Wigner 3j 記号の評価器です
     */
    @Bean
    public Wigner3jProvider wigner3jProvider() {
        log.info("Wigner 3j 記号の評価を準備しています。最大次数={}", 2 * p.getLmax());
        return new LogFactorialWigner3jProvider(2 * p.getLmax());
    }

    /**
     * 結合行列の構築器を生成します。
     *
     * @return 結合行列の構築器です
     */
    @Bean
    public CouplingMatrixBuilder couplingMatrixBuilder() {
        return new CouplingMatrixBuilder();
    }

    /**
     * ビニング演算子の生成器を生成します。
     *
     * @return ビニング演算子の生成器です
     */
    @Bean
    public Binner binner() {
        return new Binner();
    }

    /**
     * 逆行列バックエンドを生成します。
     *
     * @return 逆行列バックエンドです
     */
    @Bean
    public MatrixInversionBackend matrixInversionBackend() {
        return new EjmlMatrixInversionBackend(p.getDecoupling().getMaxConditionNumber());
    }

    /**
     * 結合行列を計算し、デカップリング器を生成します。
     *
     * @param window 窓関数です
     * @param wigner Wigner 3j 記号の評価器です
     * @param builder 結合行列の構築器です
     * @param binner ビニング演算子の生成器です
     * @param inversion 逆行列バックエンドです
     * @return デカップリング器です
     */
    @Bean
    public MaskDeconvolution maskDeconvolution(WindowFunction window, Wigner3jProvider wigner,
            CouplingMatrixBuilder builder, Binner binner, MatrixInversionBackend inversion) {
        return new MaskDeconvolution(p.getLmax(), window, wigner, builder, binner, inversion);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir(), p.getLmax());
    }
}
