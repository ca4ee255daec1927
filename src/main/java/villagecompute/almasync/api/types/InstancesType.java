/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Names of the configured instances. Credentials are never exposed.
 *
 * @param dhis2
 *            DHIS2 instance names
 * @param alma
 *            ALMA instance names
 */
@Schema(
        description = "Configured DHIS2 and ALMA instance names")
public record InstancesType(@Schema(
        example = "[\"play\"]") List<String> dhis2,

        @Schema(
                example = "[\"alma\"]") List<String> alma) {
}
