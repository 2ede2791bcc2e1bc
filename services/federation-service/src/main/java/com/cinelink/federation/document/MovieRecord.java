package com.cinelink.federation.document;

import java.util.List;

public record MovieRecord(
    String title,
    Integer year,
    List<String> genres,
    List<String> directors,
    List<String> cast,
    String plot,
    Double rating
) {
    public MovieRecord {
        genres = genres == null ? List.of() : List.copyOf(genres);
        directors = directors == null ? List.of() : List.copyOf(directors);
        cast = cast == null ? List.of() : List.copyOf(cast);
    }
}
