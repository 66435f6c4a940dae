package org.gts3.atlantis.distance.solver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class BlockCallsTest {

    @Test
    public void testParsesTwoAndThreeFieldRows() {
        BlockCalls calls = BlockCalls.parse(List.of("a.c:3,foo", "a.c:3,bar,extra", "b.c:1,baz", ""));

        assertThat(calls.calleesOf("a.c:3"), contains("foo", "bar"));
        assertThat(calls.calleesOf("b.c:1"), contains("baz"));
        assertEquals(2, calls.getCallSiteCount());
        assertEquals(0, calls.getDiscardedRows());
    }

    @Test
    public void testDiscardsMalformedRows() {
        BlockCalls calls = BlockCalls.parse(List.of("lonely", "a,b,c,d", ",foo", "a.c:3,", "a.c:4,ok"));

        assertEquals(4, calls.getDiscardedRows());
        assertThat(calls.calleesOf("a.c:4"), contains("ok"));
        assertThat(calls.calleesOf("a.c:3"), empty());
    }

    @Test
    public void testMissingFileIsEmpty(@TempDir Path tempDir) throws Exception {
        assertEquals(0, BlockCalls.readIfExists(tempDir.resolve("BBcalls.txt")).getCallSiteCount());

        Files.writeString(tempDir.resolve("BBcalls.txt"), "x.c:1,f\n");
        assertThat(BlockCalls.readIfExists(tempDir.resolve("BBcalls.txt")).calleesOf("x.c:1"), contains("f"));
    }
}
