/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Job processor registered with the queue.
 *
 * @param name
 *            processor name schedules reference
 * @param description
 *            what the processor does
 */
@Schema(
        description = "Registered job processor")
public record ProcessorType(@Schema(
        example = "dhis2-alma-sync") String name, String description) {
}
