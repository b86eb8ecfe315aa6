package com.signalwatch.scan.model;

/**
 * The scan options that change result shape, used as part of the cache key.
 */
public record ScanFingerprint(boolean activeDirectorsOnly) {
    private static final String ACTIVE_ONLY_FOLDER = "Only Active Directors";
    private static final String ALL_DIRECTORS_FOLDER = "Directors";

    public String folder() {
        return activeDirectorsOnly ? ACTIVE_ONLY_FOLDER : ALL_DIRECTORS_FOLDER;
    }
}
