/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

/**
 * Job counts per state.
 */
public record QueueStats(long waiting, long active, long completed, long failed, long delayed, long paused) {

    public long total() {
        return waiting + active + completed + failed + delayed + paused;
    }
}
