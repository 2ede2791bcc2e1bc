package com.cinelink.federation.match;

public enum MatchMode {
    SUBSTRING_ANYWHERE,
    EXACT_CASE_INSENSITIVE
}
