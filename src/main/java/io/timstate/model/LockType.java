package io.timstate.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LockType {
    /** Held until explicitly released. */
    PERSISTENT("persistent"),
    /** Tied to the lifetime of one OS process. */
    PID("pid");

    private final String dbValue;

    LockType(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static LockType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Lock type must not be blank");
        }
        for (LockType value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lock type: " + raw);
    }
}
