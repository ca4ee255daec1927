/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.almasync.jobs.QueueStats;

/**
 * Job counts per queue state.
 */
@Schema(
        description = "Job counts per queue state")
public record QueueStatsType(@Schema(
        example = "2") long waiting,

        @Schema(
                example = "1") long active,

        @Schema(
                example = "40") long completed,

        @Schema(
                example = "3") long failed,

        @Schema(
                example = "0") long delayed,

        @Schema(
                example = "0") long paused,

        @Schema(
                description = "Sum of all states",
                example = "46") long total) {

    public static QueueStatsType fromStats(QueueStats stats) {
        return new QueueStatsType(stats.waiting(), stats.active(), stats.completed(), stats.failed(), stats.delayed(),
                stats.paused(), stats.total());
    }
}
