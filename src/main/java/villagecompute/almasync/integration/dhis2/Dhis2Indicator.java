/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.integration.dhis2;

/**
 * Indicator of a DHIS2 indicator group.
 *
 * @param id
 *            DHIS2 uid, used as the {@code dx} analytics dimension
 * @param name
 *            display name
 */
public record Dhis2Indicator(String id, String name) {
}
