package org.gts3.atlantis.distance.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NameListTest {

    @Test
    public void testParseTrimsDeduplicatesAndDropsQualifiers() {
        NameList names = NameList.parse(List.of("  main ", "", "foo,12", "main", "   ", "bar"));

        assertThat(names.asList(), contains("main", "foo", "bar"));
        assertEquals(3, names.size());
        assertTrue(names.contains("foo"));
    }

    @Test
    public void testReadIfExists(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("Ftargets.txt");
        assertTrue(NameList.readIfExists(file).isEmpty());

        Files.writeString(file, "png_read_info\n");
        assertThat(NameList.readIfExists(file).asList(), contains("png_read_info"));
    }

    @Test
    public void testReadMissingFileThrows(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> NameList.read(tempDir.resolve("Fnames.txt")));
    }
}
