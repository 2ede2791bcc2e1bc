package com.cinelink.federation.graph;

public record Reviewer(String name, Number rating, String summary) {
}
