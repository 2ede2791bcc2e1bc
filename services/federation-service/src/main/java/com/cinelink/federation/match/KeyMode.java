package com.cinelink.federation.match;

/**
 * How titles from the two stores are compared during reconciliation.
 */
public enum KeyMode {
    /** Compare {@link IdentityKeys#normalize(String)} keys. */
    NORMALIZED,
    /** Compare the stored strings byte for byte. */
    EXACT;

    public String keyOf(String title) {
        if (this == EXACT) {
            return title == null || title.isBlank() ? null : title;
        }
        return IdentityKeys.normalize(title);
    }
}
