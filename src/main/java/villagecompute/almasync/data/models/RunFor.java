/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a sync pass targets the current period or the one before it.
 */
public enum RunFor {

    CURRENT("current", 0), PREVIOUS("previous", -1);

    private final String value;
    private final int offset;

    RunFor(String value, int offset) {
        this.value = value;
        this.offset = offset;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return number of periods to shift "now" by (0 or -1)
     */
    public int getOffset() {
        return offset;
    }

    @JsonCreator
    public static RunFor fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RunFor runFor : values()) {
            if (runFor.value.equals(normalized)) {
                return runFor;
            }
        }
        throw new IllegalArgumentException("Unknown runFor value: " + value);
    }
}
