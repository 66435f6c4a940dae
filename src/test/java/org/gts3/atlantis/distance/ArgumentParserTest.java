package org.gts3.atlantis.distance;

import java.nio.file.Files;
import java.nio.file.Path;

import org.gts3.atlantis.distance.graph.GraphSource;
import org.gts3.atlantis.distance.solver.Aggregation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArgumentParserTest {
    @TempDir
    Path binariesDir;

    @TempDir
    Path tempDir;

    @Test
    public void testWholeProgramDefaults() throws Exception {
        ArgumentParser parser = new ArgumentParser(new String[] {binariesDir.toString(), tempDir.toString()});

        assertEquals(binariesDir.toAbsolutePath().normalize(), parser.getBinariesDir());
        assertEquals(tempDir.toAbsolutePath().normalize(), parser.getTempDir());
        assertNull(parser.getFuzzerName());
        assertEquals(GraphSource.wholeProgram(), parser.getGraphSource());
        assertEquals(Aggregation.HARMONIC_MEAN, parser.getConfig().getAggregation());
        assertEquals(5, parser.getConfig().getMaxAttempts());
    }

    @Test
    public void testFuzzerNameAndOverrides() throws Exception {
        ArgumentParser parser = new ArgumentParser(new String[] {
                "-a", "minimum", "--max-attempts", "2", "--opt", "/usr/lib/llvm/bin/opt",
                binariesDir.toString(), tempDir.toString(), "png_fuzzer"});

        assertEquals(GraphSource.singleFuzzer("png_fuzzer"), parser.getGraphSource());
        assertEquals(Aggregation.MINIMUM, parser.getConfig().getAggregation());
        assertEquals(2, parser.getConfig().getMaxAttempts());
        assertEquals("/usr/lib/llvm/bin/opt", parser.getConfig().getOptBinary());
    }

    @Test
    public void testCommandLineOverridesConfigFile() throws Exception {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{\"max_attempts\": 7, \"aggregation\": \"arithmetic\", \"log_tail_lines\": 5}");

        ArgumentParser parser = new ArgumentParser(new String[] {
                "-c", configFile.toString(), "--max-attempts", "3", binariesDir.toString(), tempDir.toString()});

        assertEquals(3, parser.getConfig().getMaxAttempts());
        assertEquals(Aggregation.ARITHMETIC_MEAN, parser.getConfig().getAggregation());
        assertEquals(5, parser.getConfig().getLogTailLines());
    }

    @Test
    public void testHelp() throws Exception {
        assertTrue(new ArgumentParser(new String[] {"--help"}).isHelpRequested());
    }

    @Test
    public void testMissingPositionalArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {binariesDir.toString()}));
    }

    @Test
    public void testMissingDirectories() {
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {
                binariesDir.resolve("nope").toString(), tempDir.toString()}));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {
                binariesDir.toString(), tempDir.resolve("nope").toString()}));
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {
                "-a", "median", binariesDir.toString(), tempDir.toString()}));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {
                "--max-attempts", "zero", binariesDir.toString(), tempDir.toString()}));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {
                "--max-attempts", "0", binariesDir.toString(), tempDir.toString()}));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentParser(new String[] {
                "--unknown", binariesDir.toString(), tempDir.toString()}));
    }
}
