package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CompanyStatus {
    ACTIVE("active"),
    DISSOLVED("dissolved"),
    LIQUIDATION("liquidation"),
    RECEIVERSHIP("receivership"),
    ADMINISTRATION("administration"),
    VOLUNTARY_ARRANGEMENT("voluntary-arrangement"),
    CONVERTED_CLOSED("converted-closed"),
    INSOLVENCY_PROCEEDINGS("insolvency-proceedings"),
    REGISTERED("registered"),
    REMOVED("removed"),
    CLOSED("closed"),
    OPEN("open"),
    UNKNOWN("unknown");

    private final String registryValue;

    CompanyStatus(String registryValue) {
        this.registryValue = registryValue;
    }

    @JsonValue
    public String registryValue() {
        return registryValue;
    }

    @JsonCreator
    public static CompanyStatus fromRegistryValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (CompanyStatus status : values()) {
            if (status.registryValue.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
