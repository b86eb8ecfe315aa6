package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MismatchType {
    DATE_MISMATCH,
    NAME_MISMATCH,
    MISSING_DATE,
    OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
