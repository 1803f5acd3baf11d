package com.helios.transform.model;

import java.util.Locale;

/**
 * Primitive categories a {@code cast} action can convert into.
 */
public enum CastTarget {
    STRING, NUMBER, INTEGER, BOOLEAN;

    /**
     * @return the target for a rule-source name (case-insensitive), or null if unknown
     */
    public static CastTarget fromString(String text) {
        if (text == null) return null;
        try {
            return CastTarget.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
