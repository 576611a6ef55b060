package org.stockadvisor.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Investor profile used to pick safety thresholds.
 */
public enum InvestmentStyle {
    CONSERVATIVE,
    BALANCED,
    AGGRESSIVE,
    DEFAULT;

    /**
     * Lenient lookup: null, blank or unknown tags fall back to {@link #DEFAULT}.
     */
    @JsonCreator
    public static InvestmentStyle fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DEFAULT;
        }
    }

    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
