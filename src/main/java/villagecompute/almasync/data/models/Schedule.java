/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Durable schedule definition: when a DHIS2 → ALMA sync should run, what it should sync, and the last known outcome.
 *
 * <p>
 * The schedule row is the source of truth across restarts. The job runtime's own bookkeeping is reconciled against it
 * by {@link villagecompute.almasync.services.SyncScheduler#restoreActiveSchedules()}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (TEXT, PK) - Schedule identifier, also used as the job id / repeat key</li>
 * <li>{@code type} (TEXT) - IMMEDIATE, RECURRING or ONE_TIME</li>
 * <li>{@code cron_expression} (TEXT) - Cron pattern, required for RECURRING</li>
 * <li>{@code run_immediately} (BOOLEAN) - Recurring only: fire once at registration</li>
 * <li>{@code periods} (JSON) - Explicit target periods</li>
 * <li>{@code processor} (TEXT) - Processor name the job is routed to</li>
 * <li>{@code dhis2_instance}, {@code alma_instance} (TEXT) - Instance registry names</li>
 * <li>{@code scorecard} (INT), {@code indicator_group} (TEXT) - Sync target</li>
 * <li>{@code period_type}, {@code run_for} (TEXT) - Period resolution parameters</li>
 * <li>{@code data} (JSON) - Nested overrides merged into the job payload</li>
 * <li>{@code is_active} (BOOLEAN) - Desired state: should a live job exist</li>
 * <li>{@code status} (TEXT) - IDLE, RUNNING, COMPLETED, FAILED, PAUSED</li>
 * <li>{@code progress} (DOUBLE) - 0-100</li>
 * <li>{@code current_job_id} (TEXT) - Back-reference into the job runtime</li>
 * </ul>
 */
@Entity
@Table(
        name = "schedules")
public class Schedule extends PanacheEntityBase {

    public static final String DEFAULT_PROCESSOR = "dhis2-alma-sync";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_RETRY_DELAY_SECONDS = 60;

    @Id
    @Column(
            name = "id",
            nullable = false)
    public String id;

    @Column(
            name = "name",
            nullable = false)
    public String name;

    @Column(
            name = "type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public Trigger trigger;

    @Column(
            name = "cron_expression")
    public String cronExpression;

    @Column(
            name = "run_immediately",
            nullable = false)
    public boolean runImmediately;

    @Column(
            name = "periods")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> periods = new ArrayList<>();

    @Column(
            name = "processor",
            nullable = false)
    public String processor = DEFAULT_PROCESSOR;

    @Column(
            name = "dhis2_instance")
    public String dhis2Instance;

    @Column(
            name = "alma_instance")
    public String almaInstance;

    @Column(
            name = "scorecard")
    public Integer scorecard;

    @Column(
            name = "indicator_group")
    public String indicatorGroup;

    @Column(
            name = "period_type")
    @Enumerated(EnumType.STRING)
    public PeriodType periodType;

    @Column(
            name = "run_for")
    @Enumerated(EnumType.STRING)
    public RunFor runFor;

    @Column(
            name = "data")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> data = new LinkedHashMap<>();

    @Column(
            name = "is_active",
            nullable = false)
    public boolean active;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public Status status = Status.IDLE;

    @Column(
            name = "progress",
            nullable = false)
    public double progress;

    @Column(
            name = "message")
    public String message;

    @Column(
            name = "last_status")
    @Enumerated(EnumType.STRING)
    public Status lastStatus;

    @Column(
            name = "last_run")
    public Instant lastRun;

    @Column(
            name = "next_run")
    public Instant nextRun;

    @Column(
            name = "current_job_id")
    public String currentJobId;

    @Column(
            name = "retry_attempts",
            nullable = false)
    public int retryAttempts;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries = DEFAULT_MAX_RETRIES;

    @Column(
            name = "retry_delay",
            nullable = false)
    public int retryDelay = DEFAULT_RETRY_DELAY_SECONDS;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Scheduling mode.
     */
    public enum Trigger {
        /**
         * Run once, as soon as the schedule is started.
         */
        IMMEDIATE("immediate"),

        /**
         * Run on every tick of {@code cronExpression}.
         */
        RECURRING("recurring"),

        /**
         * Run once for an explicit list of periods.
         */
        ONE_TIME("one-time");

        private final String value;

        Trigger(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Trigger fromValue(String value) {
            if (value == null) {
                return null;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Trigger trigger : values()) {
                if (trigger.value.equals(normalized)) {
                    return trigger;
                }
            }
            throw new IllegalArgumentException("Unknown schedule type: " + value);
        }
    }

    /**
     * Last known outcome of the schedule.
     */
    public enum Status {
        IDLE, RUNNING, COMPLETED, FAILED, PAUSED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromValue(String value) {
            if (value == null) {
                return null;
            }
            return Status.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }

        /**
         * @return true for COMPLETED and FAILED
         */
        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    /**
     * Lists every schedule, newest first.
     *
     * @return all schedules ordered by creation time descending
     */
    public static List<Schedule> listNewestFirst() {
        return listAll(Sort.descending("createdAt"));
    }

    public static List<Schedule> findByActive(boolean active) {
        return list("active", Sort.descending("createdAt"), active);
    }

    public static List<Schedule> findByStatus(Status status) {
        if (status == null) {
            return List.of();
        }
        return list("status", Sort.descending("createdAt"), status);
    }

    /**
     * @return true when this schedule should be registered as a repeatable job
     */
    public boolean isRecurring() {
        return trigger == Trigger.RECURRING && cronExpression != null && !cronExpression.isBlank();
    }

    /**
     * Merges a partial update into this schedule. Null components keep the current value.
     *
     * @param update
     *            partial definition
     * @return true if a trigger or sync field changed, meaning an armed job carries a stale definition
     */
    public boolean applyUpdate(ScheduleUpdate update) {
        boolean jobDefinitionChanged = false;

        if (update.name() != null) {
            this.name = update.name();
        }
        if (update.trigger() != null && update.trigger() != this.trigger) {
            this.trigger = update.trigger();
            jobDefinitionChanged = true;
        }
        if (update.cronExpression() != null && !update.cronExpression().equals(this.cronExpression)) {
            this.cronExpression = update.cronExpression();
            jobDefinitionChanged = true;
        }
        if (update.runImmediately() != null && update.runImmediately() != this.runImmediately) {
            this.runImmediately = update.runImmediately();
            jobDefinitionChanged = true;
        }
        if (update.periods() != null && !update.periods().equals(this.periods)) {
            this.periods = new ArrayList<>(update.periods());
            jobDefinitionChanged = true;
        }
        if (update.processor() != null && !update.processor().equals(this.processor)) {
            this.processor = update.processor();
            jobDefinitionChanged = true;
        }
        if (update.dhis2Instance() != null && !update.dhis2Instance().equals(this.dhis2Instance)) {
            this.dhis2Instance = update.dhis2Instance();
            jobDefinitionChanged = true;
        }
        if (update.almaInstance() != null && !update.almaInstance().equals(this.almaInstance)) {
            this.almaInstance = update.almaInstance();
            jobDefinitionChanged = true;
        }
        if (update.scorecard() != null && !update.scorecard().equals(this.scorecard)) {
            this.scorecard = update.scorecard();
            jobDefinitionChanged = true;
        }
        if (update.indicatorGroup() != null && !update.indicatorGroup().equals(this.indicatorGroup)) {
            this.indicatorGroup = update.indicatorGroup();
            jobDefinitionChanged = true;
        }
        if (update.periodType() != null && update.periodType() != this.periodType) {
            this.periodType = update.periodType();
            jobDefinitionChanged = true;
        }
        if (update.runFor() != null && update.runFor() != this.runFor) {
            this.runFor = update.runFor();
            jobDefinitionChanged = true;
        }
        if (update.data() != null && !Objects.equals(update.data(), this.data)) {
            this.data = new LinkedHashMap<>(update.data());
            jobDefinitionChanged = true;
        }
        if (update.maxRetries() != null && update.maxRetries() != this.maxRetries) {
            this.maxRetries = update.maxRetries();
            jobDefinitionChanged = true;
        }
        if (update.retryDelay() != null && update.retryDelay() != this.retryDelay) {
            this.retryDelay = update.retryDelay();
            jobDefinitionChanged = true;
        }

        this.updatedAt = Instant.now();
        return jobDefinitionChanged;
    }
}
