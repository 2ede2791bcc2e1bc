package com.cinelink.federation.match;

/**
 * A MongoDB {@code $regex} expression with its {@code $options} flags.
 */
public record DocumentPattern(String regex, String options) {
}
