package com.kyb.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Three-valued risk severity returned by the KYB service.
 */
public enum RiskBand {
    RED,
    AMBER,
    GREEN;

    /**
     * Lenient decoding of a wire value. Missing or unrecognised bands map to GREEN.
     */
    @JsonCreator
    public static RiskBand fromWire(String value) {
        if (value == null || value.isBlank()) {
            return GREEN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GREEN;
        }
    }
}
