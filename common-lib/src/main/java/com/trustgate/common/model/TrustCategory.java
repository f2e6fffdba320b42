package com.trustgate.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The twenty trust dimensions that span the identity vector space.
 *
 * <p>Serialised as the snake_case key used by the trust pipeline
 * (e.g. {@code data_integrity}).
 */
public enum TrustCategory {
    SECURITY,
    RELIABILITY,
    DATA_INTEGRITY,
    PROCESS_ADHERENCE,
    CODE_QUALITY,
    TESTING,
    DOCUMENTATION,
    COMMUNICATION,
    TIME_MANAGEMENT,
    RESOURCE_EFFICIENCY,
    RISK_ASSESSMENT,
    COMPLIANCE,
    INNOVATION,
    COLLABORATION,
    ACCOUNTABILITY,
    TRANSPARENCY,
    ADAPTABILITY,
    DOMAIN_EXPERTISE,
    USER_FOCUS,
    ETHICAL_ALIGNMENT;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a pipeline label such as {@code "Data Integrity"}, {@code "data-integrity"}
     * or {@code "DATA_INTEGRITY"}. Unknown labels resolve to empty.
     */
    public static Optional<TrustCategory> fromKey(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TrustCategory c : values()) {
            if (c.name().equals(normalized)) return Optional.of(c);
        }
        return Optional.empty();
    }

    @JsonCreator
    static TrustCategory fromJson(String raw) {
        return fromKey(raw).orElseThrow(() ->
            new IllegalArgumentException("Unknown trust category: " + raw));
    }
}
