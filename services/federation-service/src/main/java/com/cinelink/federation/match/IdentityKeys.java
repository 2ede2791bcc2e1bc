package com.cinelink.federation.match;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class IdentityKeys {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IdentityKeys() {
    }

    /**
     * Comparison key for a title or name: NFC, trimmed, single-spaced, lower case.
     * Returns {@code null} when there is nothing to compare.
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String composed = Normalizer.normalize(value, Normalizer.Form.NFC).trim();
        if (composed.isEmpty()) {
            return null;
        }
        return WHITESPACE.matcher(composed).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
