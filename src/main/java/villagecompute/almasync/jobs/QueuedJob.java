/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of a job instance.
 *
 * @param id
 *            job id; the schedule id for one-shot jobs, {@code repeat:<key>:<millis>} for repeat instances
 * @param name
 *            processor name
 * @param payload
 *            job parameters
 * @param state
 *            lifecycle state
 * @param progress
 *            0-100
 * @param attemptsMade
 *            number of times a worker claimed the job
 * @param maxAttempts
 *            attempt budget
 * @param repeatKey
 *            key of the repeatable definition that spawned this instance, or null
 * @param scheduledAt
 *            earliest execution time
 * @param processedOn
 *            when the current or last attempt started
 * @param finishedOn
 *            when the job completed or finally failed
 * @param failedReason
 *            error message of the last failed attempt
 * @param createdAt
 *            submission time
 */
public record QueuedJob(String id, String name, Map<String, Object> payload, JobState state, double progress,
        int attemptsMade, int maxAttempts, String repeatKey, Instant scheduledAt, Instant processedOn,
        Instant finishedOn, String failedReason, Instant createdAt) {

    public static final String SCHEDULE_ID_KEY = "scheduleId";

    /**
     * Resolves the schedule this job belongs to: the payload's {@code scheduleId}, else the repeat key, else the job
     * id.
     */
    public String scheduleId() {
        if (payload != null && payload.get(SCHEDULE_ID_KEY) != null) {
            return String.valueOf(payload.get(SCHEDULE_ID_KEY));
        }
        if (repeatKey != null) {
            return repeatKey;
        }
        return id;
    }
}
