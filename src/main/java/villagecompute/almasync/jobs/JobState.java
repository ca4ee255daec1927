/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a job instance inside the runtime.
 */
public enum JobState {
    /**
     * Ready to be claimed by a worker.
     */
    WAITING,

    /**
     * Claimed by a worker and executing.
     */
    ACTIVE,

    /**
     * Waiting for a retry backoff to elapse.
     */
    DELAYED,

    COMPLETED,

    /**
     * Failed after exhausting its attempts.
     */
    FAILED,

    PAUSED;

    /**
     * States in which the job still represents live work.
     */
    public static final Set<JobState> IN_FLIGHT = EnumSet.of(WAITING, ACTIVE, DELAYED);

    public static final Set<JobState> FINISHED = EnumSet.of(COMPLETED, FAILED);

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobState fromValue(String value) {
        if (value == null) {
            return null;
        }
        return JobState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
