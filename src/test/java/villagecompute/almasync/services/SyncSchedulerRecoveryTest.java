/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.almasync.data.models.DelayedJob;
import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RepeatableJob;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.jobs.JobOptions;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.testing.H2TestResource;

/**
 * Startup recovery of {@link SyncScheduler} against the database-backed store and runtime.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class SyncSchedulerRecoveryTest {

    private static final String DEAD_WORKER = "dead-host:1:abcd";

    @Inject
    SyncScheduler syncScheduler;

    @Inject
    ScheduleService scheduleService;

    @Inject
    DelayedJobService delayedJobService;

    @BeforeEach
    @Transactional
    void setUp() {
        DelayedJob.deleteAll();
        RepeatableJob.deleteAll();
        Schedule.deleteAll();
    }

    @Test
    void testStoppedScheduleWithJobOfDeadWorkerIsNotRunAgain() {
        Schedule schedule = scheduleService.create(draft("stopped"));
        scheduleService.setActivation(schedule.id, false, Schedule.Status.RUNNING, 40, "Processing... 40.0%");
        seedCrashedJob(schedule.id);

        SyncScheduler.RecoveryReport report = syncScheduler.restoreActiveSchedules();

        assertEquals(1, report.requeued());
        assertEquals(1, report.interrupted());
        assertEquals(1, report.orphansRemoved());
        assertTrue(delayedJobService.getJobs(Set.of()).isEmpty());
        assertTrue(QuarkusTransaction.requiringNew()
                .call(() -> DelayedJob.findReadyIds(List.of("dhis2-alma-sync"), Instant.now(), 10)).isEmpty());

        Schedule after = scheduleService.find(schedule.id).orElseThrow();
        assertFalse(after.active);
        assertEquals(Schedule.Status.IDLE, after.status);
        assertEquals("Task interrupted due to server restart", after.message);
    }

    @Test
    void testActiveScheduleWithJobOfDeadWorkerIsQueuedAgain() {
        Schedule schedule = scheduleService.create(draft("active"));
        scheduleService.setActivation(schedule.id, true, Schedule.Status.RUNNING, 40, "Processing... 40.0%");
        seedCrashedJob(schedule.id);

        SyncScheduler.RecoveryReport report = syncScheduler.restoreActiveSchedules();

        assertEquals(1, report.requeued());
        assertEquals(1, report.inFlight());
        assertEquals(JobState.WAITING, delayedJobService.getJob(schedule.id).orElseThrow().state());
        assertEquals(Schedule.Status.RUNNING, scheduleService.find(schedule.id).orElseThrow().status);
    }

    private void seedCrashedJob(String scheduleId) {
        QuarkusTransaction.requiringNew().run(() -> {
            DelayedJob job = DelayedJob.create(scheduleId, "dhis2-alma-sync", Map.of("scheduleId", scheduleId),
                    JobOptions.defaults(), null, Instant.now());
            job.state = JobState.ACTIVE;
            job.lockedBy = DEAD_WORKER;
            job.lockedAt = Instant.now();
            job.attemptsMade = 1;
        });
    }

    private static Schedule draft(String name) {
        Schedule schedule = new Schedule();
        schedule.name = name;
        schedule.trigger = Schedule.Trigger.IMMEDIATE;
        schedule.dhis2Instance = "A";
        schedule.almaInstance = "B";
        schedule.scorecard = 42;
        schedule.indicatorGroup = "grp";
        schedule.periodType = PeriodType.MONTH;
        schedule.runFor = RunFor.PREVIOUS;
        return schedule;
    }
}
