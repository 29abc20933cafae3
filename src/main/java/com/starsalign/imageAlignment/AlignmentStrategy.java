package com.starsalign.imageAlignment;

import java.util.Locale;

/**
 * FAST feeds the normalized image to SIFT directly and suits dense, high resolution frames.
 * PRECISE goes through a 3-channel codec round trip first; slower, better on sparse or low
 * resolution frames.
 */
public enum AlignmentStrategy {
    FAST,
    PRECISE;

    public static AlignmentStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Alignment strategy must be 'fast' or 'precise'");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment strategy '" + name + "', expected 'fast' or 'precise'", e);
        }
    }
}
