/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.data.models.ScheduleUpdate;
import villagecompute.almasync.exceptions.ResourceNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache-backed {@link ScheduleStore}.
 *
 * <p>
 * Each method runs in its own transaction so progress writes from worker threads commit independently of the API
 * request that armed the job. Entities returned from here are detached; callers mutate schedules only through this
 * service.
 */
@ApplicationScoped
public class ScheduleService implements ScheduleStore {

    private static final Logger LOG = Logger.getLogger(ScheduleService.class);

    @Override
    @Transactional
    public Schedule create(Schedule schedule) {
        if (schedule.id == null || schedule.id.isBlank()) {
            schedule.id = UUID.randomUUID().toString();
        }
        Instant now = Instant.now();
        schedule.createdAt = now;
        schedule.updatedAt = now;
        schedule.persist();
        LOG.infof("Created schedule %s (%s, type=%s)", schedule.id, schedule.name, schedule.trigger);
        return schedule;
    }

    @Override
    @Transactional
    public Optional<Schedule> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Schedule.findByIdOptional(id);
    }

    @Override
    @Transactional
    public List<Schedule> listAll() {
        return Schedule.listNewestFirst();
    }

    @Override
    @Transactional
    public List<Schedule> listByActive(boolean active) {
        return Schedule.findByActive(active);
    }

    @Override
    @Transactional
    public List<Schedule> listByStatus(Schedule.Status status) {
        return Schedule.findByStatus(status);
    }

    @Override
    @Transactional
    public UpdateResult update(String id, ScheduleUpdate update) {
        Schedule schedule = require(id);
        boolean changed = schedule.applyUpdate(update);
        LOG.debugf("Updated schedule %s (job definition changed: %s)", id, changed);
        return new UpdateResult(schedule, changed);
    }

    @Override
    @Transactional
    public void delete(String id) {
        Schedule schedule = require(id);
        schedule.delete();
        LOG.infof("Deleted schedule %s", id);
    }

    @Override
    @Transactional
    public Schedule updateStatus(String id, Schedule.Status status, String message) {
        Schedule schedule = require(id);
        schedule.status = status;
        schedule.lastStatus = status;
        if (message != null) {
            schedule.message = message;
        }
        if (status.isTerminal()) {
            schedule.lastRun = Instant.now();
        }
        schedule.updatedAt = Instant.now();
        return schedule;
    }

    @Override
    @Transactional
    public Schedule updateProgress(String id, double progress) {
        Schedule schedule = require(id);
        schedule.progress = progress;
        schedule.updatedAt = Instant.now();
        return schedule;
    }

    @Override
    @Transactional
    public Schedule setCurrentJobId(String id, String jobId) {
        Schedule schedule = require(id);
        schedule.currentJobId = jobId;
        schedule.updatedAt = Instant.now();
        return schedule;
    }

    @Override
    @Transactional
    public Schedule setActivation(String id, boolean active, Schedule.Status status, double progress,
            String message) {
        Schedule schedule = require(id);
        schedule.active = active;
        schedule.status = status;
        schedule.progress = progress;
        if (message != null) {
            schedule.message = message;
        }
        schedule.updatedAt = Instant.now();
        return schedule;
    }

    @Override
    @Transactional
    public Schedule setNextRun(String id, Instant nextRun) {
        Schedule schedule = require(id);
        schedule.nextRun = nextRun;
        schedule.updatedAt = Instant.now();
        return schedule;
    }

    @Override
    @Transactional
    public Schedule setRetryAttempts(String id, int retryAttempts) {
        Schedule schedule = require(id);
        schedule.retryAttempts = retryAttempts;
        schedule.updatedAt = Instant.now();
        return schedule;
    }

    private Schedule require(String id) {
        if (id == null) {
            throw ResourceNotFoundException.schedule(null);
        }
        Schedule schedule = Schedule.findById(id);
        if (schedule == null) {
            throw ResourceNotFoundException.schedule(id);
        }
        return schedule;
    }
}
