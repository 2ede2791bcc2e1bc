package com.cinelink.federation.document;

import java.util.List;

public record MoviePage(List<MovieRecord> records, long total) {
}
