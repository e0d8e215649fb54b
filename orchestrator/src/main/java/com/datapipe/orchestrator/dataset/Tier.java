package com.datapipe.orchestrator.dataset;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value tier assigned by the transformation stage from total_value.
 */
public enum Tier {
    PREMIUM,    // total_value > 5000
    STANDARD,   // total_value > 1000
    BASIC;

    public static final double PREMIUM_THRESHOLD  = 5000;
    public static final double STANDARD_THRESHOLD = 1000;

    public static Tier of(double totalValue) {
        if (totalValue > PREMIUM_THRESHOLD)  return PREMIUM;
        if (totalValue > STANDARD_THRESHOLD) return STANDARD;
        return BASIC;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
