/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import java.util.List;

/**
 * Outcome of one sync pass.
 *
 * @param scheduleId
 *            schedule the pass ran for
 * @param periods
 *            resolved DHIS2 periods
 * @param totalUnits
 *            size of the period x level x indicator grid
 * @param succeededUnits
 *            units uploaded to ALMA
 * @param failedUnits
 *            units that failed after all unit attempts
 * @param failures
 *            error messages of the first failed units
 */
public record SyncResult(String scheduleId, List<String> periods, int totalUnits, int succeededUnits, int failedUnits,
        List<String> failures) {

    public SyncResult {
        periods = periods != null ? List.copyOf(periods) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean hasFailures() {
        return failedUnits > 0;
    }
}
