package com.cinelink.federation.graph;

public record RatedMovie(String title, Integer released, Number rating, String summary) {
}
