package io.dispatch4j.assignment;

import java.util.Locale;

public enum CapabilityType {
    BROWSER,
    DESKTOP,
    OFFICE,
    DATABASE,
    OCR,
    AI_ML,
    HIGH_MEMORY,
    HIGH_CPU,
    GPU,
    SECURE_ENCLAVE,
    CUSTOM;

    /**
     * Resolve a capability-map key such as {@code "browser"}; unknown keys map to {@link #CUSTOM}.
     */
    public static CapabilityType fromKey(String key) {
        if (key == null) {
            return CUSTOM;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CUSTOM;
        }
    }
}
