package com.cinelink.federation.match;

import java.util.regex.Pattern;

/**
 * Translates a free-text fragment into the pattern syntax of each store so that the
 * same input means the same thing on both.
 *
 * <p>MongoDB's {@code $regex} is unanchored, so a substring search is the fragment itself
 * with the {@code i} option. Cypher's {@code =~} must match the whole property value, so
 * the graph form is wrapped in {@code .*} on both sides and prefixed with {@code (?i)}.
 * Exact matching always quotes the fragment; substring matching passes metacharacters
 * through unless {@code quoteSubstring} is set.</p>
 */
public class MatchNormalizer {
    private static final String CASE_INSENSITIVE = "i";

    private final boolean quoteSubstring;

    public MatchNormalizer(boolean quoteSubstring) {
        this.quoteSubstring = quoteSubstring;
    }

    public DocumentPattern documentPattern(String fragment, MatchMode mode) {
        String checked = requireFragment(fragment);
        if (mode == MatchMode.EXACT_CASE_INSENSITIVE) {
            return new DocumentPattern("^" + Pattern.quote(checked) + "$", CASE_INSENSITIVE);
        }
        return new DocumentPattern(substringBody(checked), CASE_INSENSITIVE);
    }

    public String graphPattern(String fragment, MatchMode mode) {
        String checked = requireFragment(fragment);
        if (mode == MatchMode.EXACT_CASE_INSENSITIVE) {
            return "(?i)" + Pattern.quote(checked);
        }
        return "(?i).*" + substringBody(checked) + ".*";
    }

    private String substringBody(String fragment) {
        return quoteSubstring ? Pattern.quote(fragment) : fragment;
    }

    private static String requireFragment(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            throw new IllegalArgumentException("match fragment must not be blank");
        }
        return fragment;
    }
}
