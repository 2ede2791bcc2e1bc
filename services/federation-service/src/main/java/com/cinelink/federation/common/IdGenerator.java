package com.cinelink.federation.common;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.UUID;

public final class IdGenerator {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TRACE_ID_BYTES = 16;

    private IdGenerator() {
    }

    public static String resolveRequestId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return "req_" + UUID.randomUUID().toString().replace("-", "");
    }

    public static String resolveTraceId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            String trimmed = headerValue.trim();
            if (isValidTraceId(trimmed)) {
                return trimmed.toLowerCase(Locale.ROOT);
            }
        }
        return randomHex(TRACE_ID_BYTES);
    }

    private static boolean isValidTraceId(String value) {
        if (value.length() != 32) {
            return false;
        }
        if (value.chars().allMatch(ch -> ch == '0')) {
            return false;
        }
        return value.chars().allMatch(ch -> Character.digit(ch, 16) >= 0);
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : buffer) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
