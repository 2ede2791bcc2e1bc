package com.cinelink.federation.common;

public final class RequestUtils {
    private RequestUtils() {
    }

    public static int positiveInt(String value, String field, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw FederationException.validation(field + " must be an integer");
        }
        if (parsed < 1) {
            throw FederationException.validation(field + " must be greater than or equal to 1");
        }
        return parsed;
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String require(String value, String field) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw FederationException.validation(field + " is required");
        }
        return trimmed;
    }
}
