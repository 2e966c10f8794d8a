package dev.flowsync.domain.enums;

import java.util.Locale;

public enum ExportFormat {
    JSON("application/json"), CSV("text/csv"), TXT("text/plain");

    private final String contentType;

    ExportFormat(String contentType) { this.contentType = contentType; }

    public String contentType() { return contentType; }

    public static ExportFormat fromWire(String value) {
        if (value == null) return JSON;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value);
        }
    }
}
