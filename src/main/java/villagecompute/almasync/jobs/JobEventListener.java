/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

/**
 * Receives job outcome notifications from the runtime. Listener exceptions are logged and never affect the job.
 */
public interface JobEventListener {

    default void onCompleted(QueuedJob job) {
    }

    /**
     * @param job
     *            snapshot taken after the failure was recorded
     * @param error
     *            cause of the failed attempt
     * @param retriesExhausted
     *            true when the job moved to FAILED and will not be retried
     */
    default void onFailed(QueuedJob job, Throwable error, boolean retriesExhausted) {
    }
}
