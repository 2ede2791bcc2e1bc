package com.cinelink.federation.api.dto;

import com.cinelink.federation.document.MovieRecord;
import java.util.List;

public class MovieListResponse {
    private boolean success = true;
    private int page;
    private int limit;
    private long total;
    private int count;
    private List<MovieRecord> movies;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
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
