package com.cinelink.federation.common;

/**
 * Correlation ids of the request being served on the current thread.
 */
public record RequestContext(String requestId, String traceId) {
}
