package io.timstate.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PermissionType {
    ALLOW("allow"),
    DENY("deny");

    private final String dbValue;

    PermissionType(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static PermissionType fromString(String raw) {
        if (raw != null) {
            for (PermissionType value : values()) {
                if (value.dbValue.equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown permission type: " + raw);
    }
}
