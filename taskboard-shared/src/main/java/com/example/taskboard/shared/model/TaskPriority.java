package com.example.taskboard.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TaskPriority fromWireName(String value) {
        return valueOf(value.toUpperCase());
    }
}
