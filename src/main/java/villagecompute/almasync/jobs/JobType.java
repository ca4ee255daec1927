/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.util.Optional;

/**
 * Processors known to the service. The enum constant name is used in logs; {@link #getProcessorName()} is the name jobs
 * are submitted under and the value stored on a schedule.
 */
public enum JobType {

    /**
     * Pulls analytics from DHIS2 for every indicator/org-unit-level/period and uploads it to an ALMA scorecard.
     */
    DHIS2_ALMA_SYNC("dhis2-alma-sync", "DHIS2 analytics to ALMA scorecard synchronization");

    private final String processorName;
    private final String description;

    JobType(String processorName, String description) {
        this.processorName = processorName;
        this.description = description;
    }

    public String getProcessorName() {
        return processorName;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<JobType> fromProcessorName(String processorName) {
        for (JobType type : values()) {
            if (type.processorName.equals(processorName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
