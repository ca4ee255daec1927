/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.exceptions;

/**
 * Exception thrown when a schedule cannot be activated or executed because its sync binding is incomplete.
 *
 * <p>
 * Raised for unknown DHIS2/ALMA instance names, an unregistered processor, or a schedule missing its scorecard or
 * indicator group. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException missingInstance(String kind, String name) {
        return new ConfigurationException(kind + " instance not found in configuration: " + name);
    }
}
