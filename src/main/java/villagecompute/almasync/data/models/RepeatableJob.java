/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.almasync.jobs.JobOptions;
import villagecompute.almasync.jobs.RepeatableJobInfo;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cron-repeated job definition. Each tick spawns a {@link DelayedJob} instance that carries {@link #repeatKey}.
 */
@Entity
@Table(
        name = "repeatable_jobs")
public class RepeatableJob extends PanacheEntityBase {

    @Id
    @Column(
            name = "repeat_key",
            nullable = false)
    public String repeatKey;

    @Column(
            name = "job_name",
            nullable = false)
    public String jobName;

    @Column(
            name = "pattern",
            nullable = false)
    public String pattern;

    @Column(
            name = "payload")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload = new LinkedHashMap<>();

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "backoff_delay_seconds",
            nullable = false)
    public long backoffDelaySeconds;

    @Column(
            name = "next_run_at",
            nullable = false)
    public Instant nextRunAt;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static List<RepeatableJob> findDue(Instant now) {
        return list("nextRunAt <= ?1", Sort.ascending("nextRunAt"), now);
    }

    public static List<RepeatableJob> listOrdered() {
        return listAll(Sort.ascending("createdAt"));
    }

    /**
     * Options applied to every instance this definition spawns.
     */
    public JobOptions instanceOptions() {
        return JobOptions.oneShot(attempts, Duration.ofSeconds(backoffDelaySeconds));
    }

    public RepeatableJobInfo toInfo() {
        return new RepeatableJobInfo(repeatKey, jobName, pattern, nextRunAt, lastRunAt, createdAt);
    }
}
