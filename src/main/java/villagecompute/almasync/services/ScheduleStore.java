/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.data.models.ScheduleUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable CRUD for {@link Schedule} records.
 *
 * <p>
 * The store is the single source of truth for schedule intent. Besides plain CRUD it exposes the narrow status
 * helpers the job execution path calls on every progress tick. Update, delete and status helpers throw
 * {@link villagecompute.almasync.exceptions.ResourceNotFoundException} for unknown ids.
 *
 * @see ScheduleService for the Panache-backed implementation
 */
public interface ScheduleStore {

    /**
     * Persists a new schedule, assigning an id when absent and stamping created/updated timestamps.
     */
    Schedule create(Schedule schedule);

    Optional<Schedule> find(String id);

    /**
     * @return all schedules, newest first
     */
    List<Schedule> listAll();

    List<Schedule> listByActive(boolean active);

    List<Schedule> listByStatus(Schedule.Status status);

    /**
     * Merges a partial definition update and bumps {@code updatedAt}.
     *
     * @return the merged schedule and whether a trigger or sync field changed
     */
    UpdateResult update(String id, ScheduleUpdate update);

    void delete(String id);

    /**
     * Sets status and message. {@code lastStatus} follows every transition and {@code lastRun} is stamped when the
     * status becomes COMPLETED or FAILED.
     *
     * @param message
     *            new message, or null to keep the current one
     */
    Schedule updateStatus(String id, Schedule.Status status, String message);

    Schedule updateProgress(String id, double progress);

    Schedule setCurrentJobId(String id, String jobId);

    /**
     * Sets activation flag and resets the runtime fields that go with it.
     *
     * @param active
     *            desired activation state
     * @param status
     *            status to move to
     * @param progress
     *            progress to reset to
     * @param message
     *            message to record
     */
    Schedule setActivation(String id, boolean active, Schedule.Status status, double progress, String message);

    Schedule setNextRun(String id, Instant nextRun);

    /**
     * Records how many attempts the current job has used.
     */
    Schedule setRetryAttempts(String id, int retryAttempts);

    /**
     * Result of a partial update.
     *
     * @param schedule
     *            merged schedule
     * @param jobDefinitionChanged
     *            true when a trigger or sync field changed value
     */
    record UpdateResult(Schedule schedule, boolean jobDefinitionChanged) {
    }
}
