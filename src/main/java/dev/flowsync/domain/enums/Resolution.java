package dev.flowsync.domain.enums;

import java.util.Locale;

public enum Resolution {
    VISUAL, CHAT, MERGE;

    public static Resolution fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("resolution required");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resolution: " + value);
        }
    }
}
