package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FilingDocumentType {
    INCORPORATION("incorporation", FactContext.INCORPORATION),
    NAME_CHANGE("name-change", FactContext.NAME_CHANGE),
    ANNUAL_RETURN("annual-return", FactContext.FILING),
    OTHER("other", null);

    private final String value;
    private final FactContext extractionContext;

    FilingDocumentType(String value, FactContext extractionContext) {
        this.value = value;
        this.extractionContext = extractionContext;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Context whose phrase patterns apply to this kind of document, or null for generic extraction only.
     */
    public FactContext extractionContext() {
        return extractionContext;
    }

    public static FilingDocumentType fromCategory(String category) {
        if (category == null) {
            return OTHER;
        }
        switch (category.trim().toLowerCase(Locale.ROOT)) {
            case "incorporation":
                return INCORPORATION;
            case "change-of-name":
            case "name-change":
                return NAME_CHANGE;
            case "annual-return":
            case "confirmation-statement":
                return ANNUAL_RETURN;
            default:
                return OTHER;
        }
    }
}
