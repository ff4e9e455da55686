package io.arrestx.extractor.config;

import java.util.Locale;

/**
 * Console log encodings.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        try {
            return LogFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log format: " + raw + " (expected text or json)", ex);
        }
    }
}
