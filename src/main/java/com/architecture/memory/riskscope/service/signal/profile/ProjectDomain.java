package com.architecture.memory.riskscope.service.signal.profile;

import java.util.Arrays;
import java.util.Locale;

public enum ProjectDomain {
    WEB,
    BACKEND,
    FRONTEND,
    ML,
    CLI,
    UNKNOWN;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a configured domain; blank or unrecognised values are {@link #UNKNOWN}.
     */
    public static ProjectDomain fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.name().equals(normalized))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
