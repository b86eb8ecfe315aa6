package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactKind {
    DATE,
    NAME;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
