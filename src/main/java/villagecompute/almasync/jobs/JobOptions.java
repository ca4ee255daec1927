/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.time.Duration;

/**
 * Submission options for a job.
 *
 * @param attempts
 *            total attempts before the job is marked failed (at least 1)
 * @param backoffDelay
 *            base delay of the exponential backoff between attempts
 * @param repeat
 *            cron repetition, or null for a one-shot job
 * @param removeOnComplete
 *            delete the job record as soon as it completes
 * @param removeOnFail
 *            delete the job record as soon as it finally fails
 */
public record JobOptions(int attempts, Duration backoffDelay, Repeat repeat, boolean removeOnComplete,
        boolean removeOnFail) {

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_BACKOFF_DELAY = Duration.ofSeconds(5);

    public JobOptions {
        if (attempts < 1) {
            attempts = DEFAULT_ATTEMPTS;
        }
        if (backoffDelay == null || backoffDelay.isNegative()) {
            backoffDelay = DEFAULT_BACKOFF_DELAY;
        }
    }

    /**
     * One-shot job with default retry policy.
     */
    public static JobOptions defaults() {
        return new JobOptions(DEFAULT_ATTEMPTS, DEFAULT_BACKOFF_DELAY, null, false, false);
    }

    public static JobOptions oneShot(int attempts, Duration backoffDelay) {
        return new JobOptions(attempts, backoffDelay, null, false, false);
    }

    public static JobOptions repeating(int attempts, Duration backoffDelay, Repeat repeat) {
        return new JobOptions(attempts, backoffDelay, repeat, false, false);
    }

    public boolean isRepeating() {
        return repeat != null;
    }

    /**
     * Cron repetition of a job.
     *
     * @param pattern
     *            cron expression (5 fields, or 6 with leading seconds)
     * @param immediately
     *            fire once at registration instead of waiting for the first tick
     * @param key
     *            stable repeat key; every spawned instance carries it
     */
    public record Repeat(String pattern, boolean immediately, String key) {
    }
}
