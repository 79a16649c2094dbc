package com.rebootearth.burnrisk.domain.model;

import java.util.Locale;

/**
 * Scale a score is expressed on outside the core. Everything inside is {@link #UNIT}.
 * Conversion happens once when a value is ingested and once when it is presented.
 */
public enum ScoreScale {
    UNIT(1.0),
    DECILE(10.0);

    private final double max;

    ScoreScale(double max) {
        this.max = max;
    }

    /**
     * Converts a value on this scale to [0,1].
     *
     * @throws IllegalArgumentException if the value is not within [0, max]
     */
    public double normalize(double raw) {
        if (Double.isNaN(raw) || raw < 0.0 || raw > max) {
            throw new IllegalArgumentException(
                    "Value " + raw + " is outside the " + name().toLowerCase(Locale.ROOT) + " scale [0," + max + "]");
        }
        return raw / max;
    }

    /**
     * Converts a canonical [0,1] value to this scale for display.
     */
    public double present(double canonical) {
        return canonical * max;
    }

    public static ScoreScale fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return UNIT;
        }
        try {
            return ScoreScale.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scale '" + value + "', expected 'unit' or 'decile'");
        }
    }
}
