/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.time.Instant;

/**
 * Snapshot of a repeatable (cron) job definition.
 */
public record RepeatableJobInfo(String key, String name, String pattern, Instant nextRunAt, Instant lastRunAt,
        Instant createdAt) {
}
