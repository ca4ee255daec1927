/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

/**
 * Payload of a {@code progress_update} event.
 *
 * @param id
 *            schedule id
 * @param progress
 *            progress (0-100)
 * @param message
 *            status message shown next to the progress
 */
public record ProgressUpdateType(String id, double progress, String message) {
}
