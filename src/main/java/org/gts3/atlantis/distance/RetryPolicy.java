package org.gts3.atlantis.distance;

/**
 * Bounded retries with exponential backoff.
 *
 * The n-th retry waits {@code initialBackoff * multiplier^(n-1)} milliseconds, capped at the
 * maximum backoff.
 */
public class RetryPolicy {

    /**
     * Waits between attempts; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /**
     * One attempt of a retried operation.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws CallGraphExtractionException;
    }

    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final double backoffMultiplier;
    private final long maxBackoffMillis;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long initialBackoffMillis, double backoffMultiplier, long maxBackoffMillis,
                       Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMillis = initialBackoffMillis;
        this.backoffMultiplier = backoffMultiplier;
        this.maxBackoffMillis = maxBackoffMillis;
        this.sleeper = sleeper;
    }

    public static RetryPolicy fromConfig(PipelineConfig config) {
        return fromConfig(config, Thread::sleep);
    }

    public static RetryPolicy fromConfig(PipelineConfig config, Sleeper sleeper) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoffMillis(),
                config.getBackoffMultiplier(), config.getMaxBackoffMillis(), sleeper);
    }

    /**
     * Runs an operation until it succeeds or the attempts are used up.
     *
     * @param description What is being attempted, for the log
     * @param attempt The operation
     * @param log The step log
     * @return The result of the first successful attempt
     * @throws CallGraphExtractionException The failure of the last attempt
     * @throws InterruptedException If interrupted while backing off
     */
    public <T> T execute(String description, Attempt<T> attempt, StepLog log)
            throws CallGraphExtractionException, InterruptedException {
        for (int attemptNumber = 1; ; attemptNumber++) {
            try {
                return attempt.run();
            } catch (CallGraphExtractionException e) {
                if (attemptNumber >= maxAttempts) {
                    log.error(description + " failed after " + attemptNumber + " attempts: " + e.getMessage());
                    throw e;
                }
                long delay = backoffMillis(attemptNumber);
                log.warn(description + " failed (attempt " + attemptNumber + "/" + maxAttempts + "): "
                        + e.getMessage() + ". Retrying in " + delay + " ms..");
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * @param retry The retry number, starting at 1
     * @return The delay before that retry
     */
    long backoffMillis(int retry) {
        double delay = initialBackoffMillis * Math.pow(backoffMultiplier, retry - 1);
        return (long) Math.min(delay, maxBackoffMillis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
