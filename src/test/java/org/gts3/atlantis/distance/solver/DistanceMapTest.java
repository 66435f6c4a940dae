package org.gts3.atlantis.distance.solver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DistanceMapTest {

    @Test
    public void testRowsKeepInsertionOrder() {
        DistanceMap distances = new DistanceMap();
        distances.put("b", 1.0);
        distances.put("a", 8.0 / 3.0);
        distances.put("b", 0.5);

        assertThat(distances.toLines(), contains("b,0.5", "a,2.6666666666666665"));
    }

    @Test
    public void testRejectsInvalidDistances() {
        DistanceMap distances = new DistanceMap();

        assertThrows(IllegalArgumentException.class, () -> distances.put("a", -1.0));
        assertThrows(IllegalArgumentException.class, () -> distances.put("a", Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> distances.put("a", Double.POSITIVE_INFINITY));
    }

    @Test
    public void testSavedFileReadsBackIdentically(@TempDir Path tempDir) throws Exception {
        DistanceMap distances = new DistanceMap();
        distances.put("main", 2.6666666666666665);
        distances.put("foo", 0.0);
        Path file = tempDir.resolve("distance.callgraph.txt");

        distances.saveToFile(file);
        DistanceMap loaded = DistanceMap.read(file);

        assertEquals(distances.toLines(), loaded.toLines());
        assertEquals(List.of("main,2.6666666666666665", "foo,0.0"), Files.readAllLines(file));
    }

    @Test
    public void testReadSplitsOnLastCommaAndSkipsMalformedRows(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("distance.txt");
        Files.writeString(file, "weird,name,1.5\nnodistance\nbad,abc\n,2.0\n\nok,3\n");

        DistanceMap loaded = DistanceMap.read(file);

        assertThat(loaded.getNames(), contains("weird,name", "ok"));
        assertEquals(1.5, loaded.getDistance("weird,name").getAsDouble());
        assertFalse(loaded.hasDistance("bad"));
    }
}
