package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactContext {
    INCORPORATION("incorporation"),
    NAME_CHANGE("name_change"),
    REGISTRATION("registration"),
    FILING("filing"),
    UNSCOPED("unscoped");

    private final String value;

    FactContext(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FactContext fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNSCOPED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (FactContext context : values()) {
            if (context.value.equals(normalized)) {
                return context;
            }
        }
        return UNSCOPED;
    }
}
