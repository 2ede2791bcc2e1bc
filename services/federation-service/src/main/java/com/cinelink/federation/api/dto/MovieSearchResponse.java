package com.cinelink.federation.api.dto;

import com.cinelink.federation.document.MovieRecord;
import java.util.List;

public class MovieSearchResponse {
    private boolean success = true;
    private int count;
    private List<MovieRecord> movies;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public List<MovieRecord> getMovies() {
        return movies;
    }

    public void setMovies(List<MovieRecord> movies) {
        this.movies = movies;
    }
}
