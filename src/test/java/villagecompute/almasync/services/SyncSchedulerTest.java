/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.almasync.config.AlmaInstance;
import villagecompute.almasync.config.Dhis2Instance;
import villagecompute.almasync.config.InstanceRegistry;
import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.data.models.ScheduleUpdate;
import villagecompute.almasync.exceptions.ConfigurationException;
import villagecompute.almasync.exceptions.ExternalServiceException;
import villagecompute.almasync.exceptions.ResourceNotFoundException;
import villagecompute.almasync.exceptions.ValidationException;
import villagecompute.almasync.jobs.JobOptions;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.jobs.ProgressReporter;
import villagecompute.almasync.jobs.QueuedJob;
import villagecompute.almasync.jobs.RepeatableJobInfo;
import villagecompute.almasync.jobs.SyncJobPayload;
import villagecompute.almasync.testing.InMemoryJobRuntime;
import villagecompute.almasync.testing.InMemoryScheduleStore;

/**
 * Unit tests for {@link SyncScheduler} against in-memory store and runtime.
 */
class SyncSchedulerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private InMemoryScheduleStore store;
    private InMemoryJobRuntime runtime;
    private SyncExecutor executor;
    private RecordingChannel channel;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        runtime = new InMemoryJobRuntime();
        executor = mock(SyncExecutor.class);

        StatusBroadcaster broadcaster = new StatusBroadcaster(objectMapper);
        channel = new RecordingChannel();
        broadcaster.register(channel);

        scheduler = new SyncScheduler();
        scheduler.store = store;
        scheduler.runtime = runtime;
        scheduler.broadcaster = broadcaster;
        scheduler.executor = executor;
        scheduler.instanceRegistry = InstanceRegistry.of(
                Map.of("A", new Dhis2Instance("A", "http://dhis2.test/api", "admin", "district")),
                Map.of("B", new AlmaInstance("B", "http://alma.test/api", "user", "pass", "https://backend.test")));
        scheduler.concurrency = 2;
        scheduler.timezone = "UTC";
        scheduler.initialize();
    }

    @Test
    void testInitializeRegistersProcessorAndStartsWorkers() {
        assertTrue(runtime.hasProcessor("dhis2-alma-sync"));
        assertTrue(runtime.isProcessing());
        assertEquals(2, runtime.getConcurrency());
    }

    @Test
    void testCreate_storesInactiveIdleSchedule() {
        Schedule created = scheduler.create(immediateDraft());

        assertNotNull(created.id);
        assertFalse(created.active);
        assertEquals(Schedule.Status.IDLE, created.status);
        assertEquals("Schedule created", created.message);
        assertTrue(runtime.allJobs().isEmpty(), "Creating a schedule must not submit a job");
        assertEquals("schedule_created", channel.types().get(0));
    }

    @Test
    void testCreate_rejectsRecurringWithoutCron() {
        Schedule draft = immediateDraft();
        draft.trigger = Schedule.Trigger.RECURRING;

        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.create(draft));
        assertEquals("Cron expression is required for recurring schedules", e.getMessage());
    }

    @Test
    void testCreate_rejectsInvalidCron() {
        Schedule draft = immediateDraft();
        draft.trigger = Schedule.Trigger.RECURRING;
        draft.cronExpression = "not a cron";

        assertThrows(ValidationException.class, () -> scheduler.create(draft));
    }

    @Test
    void testStartTwice_leavesExactlyOneJob() {
        Schedule created = scheduler.create(immediateDraft());

        scheduler.start(created.id);
        Schedule started = scheduler.start(created.id);

        List<QueuedJob> jobs = runtime.getJobs(Set.of());
        assertEquals(1, jobs.size());
        assertEquals(created.id, jobs.get(0).id());
        assertTrue(started.active);
        assertEquals(created.id, started.currentJobId);
        assertEquals("Ready to start", started.message);
    }

    @Test
    void testStart_broadcastsStartingProgressThenStarted() {
        Schedule created = scheduler.create(immediateDraft());
        channel.clear();

        scheduler.start(created.id);

        assertEquals(List.of("progress_update", "schedule_started"), channel.types());
        assertEquals("Starting job...", channel.events().get(0).path("data").path("message").asText());
    }

    @Test
    void testStart_unknownScheduleThrowsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> scheduler.start("missing"));
    }

    @Test
    void testStart_unknownInstanceIsConfigurationError() {
        Schedule draft = immediateDraft();
        draft.dhis2Instance = "nowhere";
        Schedule created = scheduler.create(draft);

        assertThrows(ConfigurationException.class, () -> scheduler.start(created.id));
        assertFalse(store.find(created.id).orElseThrow().active);
        assertTrue(runtime.allJobs().isEmpty());
    }

    @Test
    void testStart_incompleteBindingIsConfigurationError() {
        Schedule draft = immediateDraft();
        draft.scorecard = null;
        Schedule created = scheduler.create(draft);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> scheduler.start(created.id));
        assertEquals("Scorecard is required", e.getMessage());
    }

    @Test
    void testStart_payloadMergesDataOverrides() {
        Schedule draft = immediateDraft();
        draft.data = Map.of("indicatorGroup", "override-group", "level", 3);
        Schedule created = scheduler.create(draft);

        scheduler.start(created.id);

        Map<String, Object> payload = runtime.getJob(created.id).orElseThrow().payload();
        assertEquals("override-group", payload.get(SyncJobPayload.KEY_INDICATOR_GROUP));
        assertEquals(created.id, payload.get(SyncJobPayload.KEY_SCHEDULE_ID));
        assertEquals(3, payload.get("level"));
    }

    @Test
    void testRecurringMidnight_startRegistersRepeatableAndStopRemovesIt() {
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));

        Schedule started = scheduler.start(created.id);

        List<RepeatableJobInfo> repeatables = runtime.getRepeatableJobs();
        assertEquals(1, repeatables.size());
        assertEquals(created.id, repeatables.get(0).key());
        assertEquals("0 0 * * *", repeatables.get(0).pattern());
        assertEquals(created.id, started.currentJobId);
        assertNotNull(started.nextRun);

        Schedule stopped = scheduler.stop(created.id);

        assertTrue(runtime.getRepeatableJobs().isEmpty());
        assertFalse(stopped.active);
        assertEquals(Schedule.Status.IDLE, stopped.status);
        assertEquals("Stopped", stopped.message);
        assertNull(stopped.nextRun);
    }

    @Test
    void testRecurringTick_runsSyncAndKeepsDefinition() throws Exception {
        when(executor.execute(any(), any())).thenReturn(new SyncResult("x", List.of("202403"), 4, 4, 0, List.of()));
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));
        scheduler.start(created.id);

        String instanceId = runtime.fire(created.id, Instant.parse("2024-03-15T00:00:00Z"));
        runtime.run(instanceId);

        Schedule after = store.find(created.id).orElseThrow();
        assertEquals(Schedule.Status.COMPLETED, after.status);
        assertEquals(100.0, after.progress);
        assertEquals(1, runtime.getRepeatableJobs().size());
        assertTrue(after.active);
    }

    @Test
    void testStopDuringRecurringRun_keepsNextRunCleared() throws Exception {
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));
        scheduler.start(created.id);
        String instanceId = runtime.fire(created.id, Instant.parse("2024-03-15T00:00:00Z"));
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            scheduler.stop(created.id);
            return new SyncResult("x", List.of("202403"), 4, 4, 0, List.of());
        });

        runtime.run(instanceId);

        Schedule after = store.find(created.id).orElseThrow();
        assertFalse(after.active);
        assertEquals(Schedule.Status.COMPLETED, after.status);
        assertNull(after.nextRun, "A stopped schedule has no next run");
        assertTrue(runtime.getRepeatableJobs().isEmpty());
    }

    @Test
    void testStopThenDelete_withActiveJobIsSafe() {
        Schedule created = scheduler.create(recurringDraft("*/5 * * * *"));
        scheduler.start(created.id);
        String instanceId = runtime.fire(created.id, Instant.now());
        runtime.setState(instanceId, JobState.ACTIVE);

        assertDoesNotThrow(() -> scheduler.delete(created.id));

        assertTrue(store.find(created.id).isEmpty());
        assertTrue(runtime.getRepeatableJobs().isEmpty(), "No repeatable definition may outlive the schedule");
        assertEquals(JobState.ACTIVE, runtime.getJob(instanceId).orElseThrow().state(),
                "The running instance is left to finish");
        assertTrue(channel.types().contains("schedule_deleted"));
    }

    @Test
    void testDelete_waitsForLockAndKeepsIt() throws Exception {
        Schedule created = scheduler.create(immediateDraft());
        ReentrantLock lock = scheduler.lockFor(created.id);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        lock.lock();
        try {
            Future<?> deletion = pool.submit(() -> scheduler.delete(created.id));
            assertThrows(TimeoutException.class, () -> deletion.get(200, TimeUnit.MILLISECONDS));
            assertTrue(store.find(created.id).isPresent(), "Deletion must wait for the schedule lock");

            lock.unlock();
            deletion.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertTrue(store.find(created.id).isEmpty());
        assertSame(lock, scheduler.lockFor(created.id), "Callers after a delete share the same lock");
        assertFalse(lock.isLocked());
    }

    @Test
    void testDelete_unknownScheduleThrowsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> scheduler.delete("missing"));
    }

    @Test
    void testProgressIsMonotonicAndEndsAtHundred() throws Exception {
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            ProgressReporter progress = invocation.getArgument(1);
            progress.report(10);
            progress.report(50);
            progress.report(30);
            progress.report(150);
            return new SyncResult("x", List.of("202403"), 4, 4, 0, List.of());
        });
        Schedule created = scheduler.create(immediateDraft());
        scheduler.start(created.id);
        channel.clear();

        runtime.run(created.id);

        List<Double> reported = new ArrayList<>();
        for (JsonNode event : channel.events()) {
            if ("progress_update".equals(event.path("type").asText())) {
                reported.add(event.path("data").path("progress").asDouble());
            }
        }
        assertEquals(List.of(10.0, 50.0, 50.0, 100.0, 100.0), reported);

        Schedule after = store.find(created.id).orElseThrow();
        assertEquals(Schedule.Status.COMPLETED, after.status);
        assertEquals("Job completed successfully", after.message);
        assertEquals(100.0, after.progress);
        assertNull(after.currentJobId);
        assertNotNull(after.lastRun);
    }

    @Test
    void testUnitFailures_areReportedInCompletionMessage() throws Exception {
        when(executor.execute(any(), any()))
                .thenReturn(new SyncResult("x", List.of("202403"), 10, 8, 2, List.of("a", "b")));
        Schedule created = scheduler.create(immediateDraft());
        scheduler.start(created.id);

        runtime.run(created.id);

        Schedule after = store.find(created.id).orElseThrow();
        assertEquals(Schedule.Status.COMPLETED, after.status);
        assertEquals("Job completed successfully (2 of 10 sync units failed)", after.message);
    }

    @Test
    void testFailure_retriesThenRecordsExhaustion() throws Exception {
        when(executor.execute(any(), any())).thenThrow(new ExternalServiceException("DHIS2 unreachable"));
        Schedule draft = immediateDraft();
        draft.maxRetries = 2;
        Schedule created = scheduler.create(draft);
        scheduler.start(created.id);

        runtime.run(created.id);

        Schedule afterFirst = store.find(created.id).orElseThrow();
        assertEquals(Schedule.Status.FAILED, afterFirst.status);
        assertEquals("DHIS2 unreachable", afterFirst.message);
        assertEquals(1, afterFirst.retryAttempts);
        assertEquals(JobState.DELAYED, runtime.getJob(created.id).orElseThrow().state());

        runtime.run(created.id);

        Schedule afterLast = store.find(created.id).orElseThrow();
        assertEquals(Schedule.Status.FAILED, afterLast.status);
        assertEquals("Failed after 2 attempts: DHIS2 unreachable", afterLast.message);
        assertEquals(2, afterLast.retryAttempts);
        assertEquals(JobState.FAILED, runtime.getJob(created.id).orElseThrow().state());
    }

    @Test
    void testJobForDeletedSchedule_isANoOp() throws Exception {
        runtime.submit("ghost", "dhis2-alma-sync", Map.of("scheduleId", "ghost"), JobOptions.defaults());

        runtime.run("ghost");

        assertEquals(JobState.COMPLETED, runtime.getJob("ghost").orElseThrow().state());
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void testUpdate_activeRecurringScheduleIsReArmed() {
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));
        scheduler.start(created.id);

        scheduler.update(created.id, cronUpdate("30 2 * * *"));

        List<RepeatableJobInfo> repeatables = runtime.getRepeatableJobs();
        assertEquals(1, repeatables.size());
        assertEquals("30 2 * * *", repeatables.get(0).pattern());
    }

    @Test
    void testUpdate_inactiveScheduleDoesNotSubmit() {
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));

        Schedule updated = scheduler.update(created.id, cronUpdate("30 2 * * *"));

        assertEquals("30 2 * * *", updated.cronExpression);
        assertTrue(runtime.getRepeatableJobs().isEmpty());
        assertTrue(channel.types().contains("schedule_update"));
    }

    @Test
    void testUpdate_invalidCronIsRejected() {
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));

        assertThrows(ValidationException.class, () -> scheduler.update(created.id, cronUpdate("61 * * * *")));
        assertEquals("0 0 * * *", store.find(created.id).orElseThrow().cronExpression);
    }

    @Test
    void testRecovery_reArmsRecurringScheduleAndConverges() {
        Schedule schedule = recurringDraft("0 0 * * *");
        schedule.active = true;
        schedule.status = Schedule.Status.IDLE;
        store.create(schedule);

        SyncScheduler.RecoveryReport first = scheduler.restoreActiveSchedules();

        assertEquals(1, first.rearmed());
        List<RepeatableJobInfo> afterFirst = runtime.getRepeatableJobs();
        assertEquals(1, afterFirst.size());
        assertEquals(schedule.id, afterFirst.get(0).key());

        SyncScheduler.RecoveryReport second = scheduler.restoreActiveSchedules();

        assertEquals(1, second.rearmed());
        assertEquals(0, second.orphansRemoved());
        assertEquals(1, runtime.getRepeatableJobs().size());
        assertEquals(schedule.id, runtime.getRepeatableJobs().get(0).key());
    }

    @Test
    void testRecovery_vanishedImmediateJobIsResetAndResubmitted() {
        Schedule schedule = immediateDraft();
        schedule.active = true;
        schedule.status = Schedule.Status.RUNNING;
        schedule.progress = 42;
        schedule.currentJobId = "lost";
        store.create(schedule);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(1, report.interrupted());
        assertEquals(1, report.resubmitted());
        Schedule after = store.find(schedule.id).orElseThrow();
        assertEquals(Schedule.Status.IDLE, after.status);
        assertEquals("Task interrupted due to server restart", after.message);
        assertEquals(0.0, after.progress);
        assertEquals(JobState.WAITING, runtime.getJob(schedule.id).orElseThrow().state());
    }

    @Test
    void testRecovery_vanishedOneTimeJobIsResetOnly() {
        Schedule schedule = immediateDraft();
        schedule.trigger = Schedule.Trigger.ONE_TIME;
        schedule.periods = List.of("202401");
        schedule.active = true;
        schedule.status = Schedule.Status.RUNNING;
        store.create(schedule);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(1, report.interrupted());
        assertEquals(0, report.resubmitted());
        assertTrue(runtime.getJob(schedule.id).isEmpty());
    }

    @Test
    void testRecovery_mirrorsFinishedJobOutcome() {
        Schedule completed = immediateDraft();
        completed.active = true;
        completed.status = Schedule.Status.RUNNING;
        store.create(completed);
        runtime.submit(completed.id, "dhis2-alma-sync", Map.of("scheduleId", completed.id), JobOptions.defaults());
        runtime.setState(completed.id, JobState.COMPLETED);

        Schedule failed = immediateDraft();
        failed.active = true;
        failed.status = Schedule.Status.RUNNING;
        store.create(failed);
        runtime.submit(failed.id, "dhis2-alma-sync", Map.of("scheduleId", failed.id), JobOptions.defaults());
        runtime.setState(failed.id, JobState.FAILED);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(2, report.reconciled());
        assertEquals(Schedule.Status.COMPLETED, store.find(completed.id).orElseThrow().status);
        assertEquals(Schedule.Status.FAILED, store.find(failed.id).orElseThrow().status);
        assertEquals("boom", store.find(failed.id).orElseThrow().message);
    }

    @Test
    void testRecovery_leavesInFlightJobAlone() {
        Schedule schedule = immediateDraft();
        schedule.active = true;
        schedule.status = Schedule.Status.RUNNING;
        store.create(schedule);
        runtime.submit(schedule.id, "dhis2-alma-sync", Map.of("scheduleId", schedule.id), JobOptions.defaults());
        runtime.setState(schedule.id, JobState.ACTIVE);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(1, report.inFlight());
        assertEquals(Schedule.Status.RUNNING, store.find(schedule.id).orElseThrow().status);
        assertEquals(JobState.ACTIVE, runtime.getJob(schedule.id).orElseThrow().state());
    }

    @Test
    void testRecovery_stoppedScheduleWithCrashedJobIsNotRunAgain() {
        Schedule schedule = immediateDraft();
        schedule.active = false;
        schedule.status = Schedule.Status.RUNNING;
        store.create(schedule);
        runtime.submit(schedule.id, "dhis2-alma-sync", Map.of("scheduleId", schedule.id), JobOptions.defaults());
        runtime.crash(schedule.id);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(1, report.requeued());
        assertEquals(1, report.orphansRemoved());
        assertEquals(1, report.interrupted());
        assertTrue(runtime.getJob(schedule.id).isEmpty(), "The crashed job of a stopped schedule must not run again");

        Schedule after = store.find(schedule.id).orElseThrow();
        assertFalse(after.active);
        assertEquals(Schedule.Status.IDLE, after.status);
        assertEquals("Task interrupted due to server restart", after.message);
    }

    @Test
    void testRecovery_activeScheduleWithCrashedJobRunsAgain() {
        Schedule schedule = immediateDraft();
        schedule.active = true;
        schedule.status = Schedule.Status.RUNNING;
        store.create(schedule);
        runtime.submit(schedule.id, "dhis2-alma-sync", Map.of("scheduleId", schedule.id), JobOptions.defaults());
        runtime.crash(schedule.id);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(1, report.requeued());
        assertEquals(1, report.inFlight());
        assertEquals(JobState.WAITING, runtime.getJob(schedule.id).orElseThrow().state());
    }

    @Test
    void testRecovery_stoppedScheduleMirrorsFinishedJob() {
        Schedule schedule = immediateDraft();
        schedule.active = false;
        schedule.status = Schedule.Status.RUNNING;
        store.create(schedule);
        runtime.submit(schedule.id, "dhis2-alma-sync", Map.of("scheduleId", schedule.id), JobOptions.defaults());
        runtime.setState(schedule.id, JobState.COMPLETED);

        SyncScheduler.RecoveryReport report = scheduler.restoreActiveSchedules();

        assertEquals(1, report.reconciled());
        assertEquals(Schedule.Status.COMPLETED, store.find(schedule.id).orElseThrow().status);
    }

    @Test
    void testOrphanSweep_removesUnownedEntriesAndIsIdempotent() {
        Schedule kept = scheduler.create(immediateDraft());
        scheduler.start(kept.id);

        runtime.submit("ghost-job", "dhis2-alma-sync", Map.of("scheduleId", "ghost-job"), JobOptions.defaults());
        runtime.submit("ghost-cron", "dhis2-alma-sync", Map.of(),
                JobOptions.repeating(3, null, new JobOptions.Repeat("0 0 * * *", false, "ghost-cron")));
        runtime.submit("ghost-active", "dhis2-alma-sync", Map.of(), JobOptions.defaults());
        runtime.setState("ghost-active", JobState.ACTIVE);

        assertEquals(2, scheduler.sweepOrphans());

        assertTrue(runtime.getJob("ghost-job").isEmpty());
        assertTrue(runtime.getRepeatableJob("ghost-cron").isEmpty());
        assertTrue(runtime.getJob("ghost-active").isPresent(), "Running jobs are never swept");
        assertTrue(runtime.getJob(kept.id).isPresent());

        assertEquals(0, scheduler.sweepOrphans());
    }

    @Test
    void testStatus_fallsBackToJobKeyedByScheduleId() {
        Schedule created = scheduler.create(recurringDraft("0 0 * * *"));
        scheduler.start(created.id);
        String instanceId = runtime.fire(created.id, Instant.now());

        SyncScheduler.ScheduleStatus status = scheduler.getStatus(created.id);

        assertEquals(instanceId, status.job().orElseThrow().id());
    }

    private static Schedule immediateDraft() {
        Schedule schedule = new Schedule();
        schedule.name = "Malaria scorecard";
        schedule.trigger = Schedule.Trigger.IMMEDIATE;
        schedule.dhis2Instance = "A";
        schedule.almaInstance = "B";
        schedule.scorecard = 42;
        schedule.indicatorGroup = "grp";
        schedule.periodType = PeriodType.MONTH;
        schedule.runFor = RunFor.PREVIOUS;
        return schedule;
    }

    private static Schedule recurringDraft(String cron) {
        Schedule schedule = immediateDraft();
        schedule.trigger = Schedule.Trigger.RECURRING;
        schedule.cronExpression = cron;
        return schedule;
    }

    private static ScheduleUpdate cronUpdate(String cron) {
        return new ScheduleUpdate(null, null, cron, null, null, null, null, null, null, null, null, null, null, null,
                null);
    }

    /**
     * Channel capturing every broadcast message.
     */
    private final class RecordingChannel implements StatusChannel {

        private final List<String> messages = new ArrayList<>();

        @Override
        public String id() {
            return "recorder";
        }

        @Override
        public boolean isOpen() {
            return true;
        }

        @Override
        public synchronized void send(String message) {
            messages.add(message);
        }

        synchronized void clear() {
            messages.clear();
        }

        synchronized List<JsonNode> events() {
            List<JsonNode> events = new ArrayList<>();
            for (String message : messages) {
                try {
                    events.add(objectMapper.readTree(message));
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }
            return events;
        }

        List<String> types() {
            return events().stream().map(event -> event.path("type").asText()).toList();
        }
    }
}
