/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * DHIS2 period granularity a schedule synchronizes.
 */
public enum PeriodType {

    DAY("day"), WEEK("week"), MONTH("month"), QUARTER("quarter"), YEAR("year");

    private final String value;

    PeriodType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses the lower-case wire value, accepting enum names as well.
     *
     * @param value
     *            wire value such as {@code "month"}
     * @return matching period type, or null when value is null
     * @throws IllegalArgumentException
     *             if the value is not a known period type
     */
    @JsonCreator
    public static PeriodType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PeriodType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown period type: " + value);
    }
}
