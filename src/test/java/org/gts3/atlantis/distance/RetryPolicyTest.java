package org.gts3.atlantis.distance;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RetryPolicyTest {
    @TempDir
    Path tempDir;

    @Test
    public void testBackoffGrowsAndIsCapped() {
        RetryPolicy policy = new RetryPolicy(10, 100, 3.0, 500, millis -> { });

        assertEquals(100, policy.backoffMillis(1));
        assertEquals(300, policy.backoffMillis(2));
        assertEquals(500, policy.backoffMillis(3));
        assertEquals(500, policy.backoffMillis(9));
    }

    @Test
    public void testReturnsFirstSuccess() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(5, 1, 2.0, 100, sleeps::add);
        StepLog log = StepLog.start(tempDir, PipelineStep.CALL_GRAPH_DISTANCE);
        int[] attempts = {0};

        String result = policy.execute("test", () -> {
            if (++attempts[0] < 3) {
                throw new CallGraphExtractionException("flaky");
            }
            return "ok";
        }, log);

        assertEquals("ok", result);
        assertEquals(List.of(1L, 2L), sleeps);
    }

    @Test
    public void testGivesUpAfterMaxAttempts() throws Exception {
        RetryPolicy policy = new RetryPolicy(2, 1, 2.0, 100, millis -> { });
        StepLog log = StepLog.start(tempDir, PipelineStep.CALL_GRAPH_DISTANCE);
        int[] attempts = {0};

        assertThrows(CallGraphExtractionException.class, () -> policy.execute("test", () -> {
            attempts[0]++;
            throw new CallGraphExtractionException("broken");
        }, log));
        assertEquals(2, attempts[0]);
    }

    @Test
    public void testRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1, 2.0, 100, millis -> { }));
    }
}
