/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.exceptions;

/**
 * Exception thrown when a schedule or job referenced by id does not exist.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ResourceNotFoundException schedule(String scheduleId) {
        return new ResourceNotFoundException("Schedule not found: " + scheduleId);
    }
}
