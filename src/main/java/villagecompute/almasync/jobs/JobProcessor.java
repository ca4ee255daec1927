/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

/**
 * Executes jobs submitted under a processor name.
 *
 * <p>
 * <b>Error Handling:</b> Throwing from {@link #process} fails the current attempt; the runtime schedules a retry with
 * exponential backoff until the job's attempts are exhausted.
 *
 * <p>
 * <b>Progress:</b> The runtime sets progress to 0 before invoking the processor and to 100 after it returns normally.
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * @param job
     *            snapshot of the claimed job
     * @param progress
     *            progress callback bound to this job
     * @throws Exception
     *             to fail the attempt
     */
    void process(QueuedJob job, ProgressReporter progress) throws Exception;
}
