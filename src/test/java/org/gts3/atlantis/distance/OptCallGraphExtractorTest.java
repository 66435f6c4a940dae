package org.gts3.atlantis.distance;

import java.nio.file.Path;

import org.gts3.atlantis.distance.graph.BitcodeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class OptCallGraphExtractorTest {
    @TempDir
    Path tempDir;

    @Test
    public void testMissingExecutablePathIsReported() throws Exception {
        StepLog log = StepLog.start(tempDir, PipelineStep.CALL_GRAPH_DISTANCE);
        BitcodeModule module = new BitcodeModule("prog", tempDir.resolve("prog.0.0.preopt.bc"));
        OptCallGraphExtractor extractor = new OptCallGraphExtractor(tempDir.resolve("bin").resolve("opt").toString());

        ToolNotFoundException e = assertThrows(ToolNotFoundException.class,
                () -> extractor.extract(module, tempDir.resolve("prog"), log));
        assertThat(e.getMessage(), containsString("opt"));
    }

    @Test
    public void testMissingExecutableOnPathIsReported() throws Exception {
        StepLog log = StepLog.start(tempDir, PipelineStep.CALL_GRAPH_DISTANCE);
        BitcodeModule module = new BitcodeModule("prog", tempDir.resolve("prog.0.0.preopt.bc"));
        OptCallGraphExtractor extractor = new OptCallGraphExtractor("opt-that-does-not-exist-17");

        assertThrows(ToolNotFoundException.class, () -> extractor.extract(module, tempDir.resolve("prog"), log));
    }
}
