package io.github.yok.pcl.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.pcl.core.decoupling.MaskDeconvolution;
import io.github.yok.pcl.core.decoupling.MaskDeconvolution.BinningState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"pcl.lmax=8",
        "pcl.window.file=src/test/resources/fixtures/window_lmax8.csv",
        "pcl.spectrum.file=src/test/resources/fixtures/spectrum_lmax8.csv",
        "pcl.theory.file=src/test/resources/fixtures/spectrum_lmax8.csv",
        "pcl.binning.bin-widths=2,3", "pcl.output.dir=target/cli-test-out"})
class PclCliRunnerTest {

    private static final Path OUT = Paths.get("target/cli-test-out");

    @Autowired
    private MaskDeconvolution maskDeconvolution;

    @Autowired
    private PclProperties properties;

    @Test
    void scansConfiguredBinWidthsAndWritesResults() throws IOException {
        List<String> lperBin2 = Files.readAllLines(OUT.resolve("pcl_bandpowers_lperBin=2.csv"),
                StandardCharsets.UTF_8);
        List<String> lperBin3 = Files.readAllLines(OUT.resolve("pcl_bandpowers_lperBin=3.csv"),
                StandardCharsets.UTF_8);

        // ヘッダ + ビン数（9/2=4、9/3=3）
        assertEquals(5, lperBin2.size());
        assertEquals(4, lperBin3.size());
        assertEquals("bin,ell,bandpower,theoryConvolved", lperBin2.get(0));
        assertTrue(Files.exists(OUT.resolve("pcl_meta_lperBin=3.csv")));
    }

    @Test
    void lastBinWidthStaysCached() {
        assertEquals(BinningState.READY, maskDeconvolution.getBinningState());
        assertEquals(3, maskDeconvolution.getLperBin());
        assertEquals(8, maskDeconvolution.getLmax());
    }

    @Test
    void propertiesRenderAsMultilineText() {
        String text = properties.toMultilineString();

        assertTrue(text.contains("  lmax: 8"));
        assertTrue(text.contains("    binWidths: [2, 3]"));
        assertTrue(text.contains("    fullSky: false"));
        assertTrue(text.contains("    dir: target/cli-test-out"));
    }
}
