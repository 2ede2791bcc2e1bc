package com.cinelink.federation.graph;

import java.util.List;

public record PersonRatings(String name, Integer born, int ratedCount, List<RatedMovie> ratedMovies) {
}
