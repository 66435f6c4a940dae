package org.gts3.atlantis.distance.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModuleResolverTest {
    @TempDir
    Path binariesDir;

    private void touch(String... fileNames) throws IOException {
        for (String fileName : fileNames) {
            Files.createFile(binariesDir.resolve(fileName));
        }
    }

    @Test
    public void testWholeProgramListsModulesByName() throws IOException {
        touch("zlib_fuzzer.0.0.preopt.bc", "png_fuzzer.0.0.preopt.bc", "notes.txt", "png_fuzzer");
        Files.createDirectory(binariesDir.resolve("nested.0.0.preopt.bc"));

        List<BitcodeModule> modules = new ModuleResolver(binariesDir).resolve(GraphSource.wholeProgram());

        assertThat(modules.stream().map(BitcodeModule::getName).toList(), contains("png_fuzzer", "zlib_fuzzer"));
    }

    @Test
    public void testWholeProgramKeepsFirstFileOfDuplicateModule() throws IOException {
        touch("fuzz.0.0.preopt.bc", "fuzz.0.0.opt.bc");

        List<BitcodeModule> modules = new ModuleResolver(binariesDir).resolve(GraphSource.wholeProgram());

        assertEquals(1, modules.size());
        assertEquals(binariesDir.resolve("fuzz.0.0.opt.bc"), modules.get(0).getBitcodeFile());
    }

    @Test
    public void testWholeProgramWithoutBitcodeThrows() throws IOException {
        touch("readme.md");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ModuleResolver(binariesDir).resolve(GraphSource.wholeProgram()));
        assertThat(e.getMessage(), containsString("Couldn't find any binaries"));
    }

    @Test
    public void testSingleFuzzerResolvesExactlyOneFile() throws IOException {
        touch("fuzz.0.0.preopt.bc", "fuzz_other.0.0.preopt.bc");

        List<BitcodeModule> modules = new ModuleResolver(binariesDir).resolve(GraphSource.singleFuzzer("fuzz"));

        assertEquals(1, modules.size());
        assertEquals("fuzz", modules.get(0).getName());
        assertEquals(binariesDir.resolve("fuzz.0.0.preopt.bc"), modules.get(0).getBitcodeFile());
    }

    @Test
    public void testUnknownFuzzerThrows() throws IOException {
        touch("fuzz.0.0.preopt.bc");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ModuleResolver(binariesDir).resolve(GraphSource.singleFuzzer("missing")));
        assertThat(e.getMessage(), containsString("Couldn't find bytecode for fuzzer missing"));
    }

    @Test
    public void testAmbiguousFuzzerThrows() throws IOException {
        touch("fuzz.0.0.preopt.bc", "fuzz.0.0.opt.bc");

        assertThrows(IllegalArgumentException.class,
                () -> new ModuleResolver(binariesDir).resolve(GraphSource.singleFuzzer("fuzz")));
    }

    @Test
    public void testModuleNames() {
        assertEquals("fuzz", ModuleResolver.moduleName(Path.of("fuzz.0.0.preopt.bc")));
        assertEquals("lib.v2", ModuleResolver.moduleName(Path.of("lib.v2.0.0.preopt.bc")));
        assertTrue(ModuleResolver.isBitcodeFile("a.0.0.b.bc"));
        assertFalse(ModuleResolver.isBitcodeFile("a.bc"));
        assertFalse(ModuleResolver.isBitcodeFile("a.0.0.b.ll"));
    }
}
