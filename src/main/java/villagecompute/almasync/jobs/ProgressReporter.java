/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

/**
 * Callback a processor uses to publish progress of the running job.
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * @param progress
     *            percentage in [0, 100]
     */
    void report(double progress);
}
