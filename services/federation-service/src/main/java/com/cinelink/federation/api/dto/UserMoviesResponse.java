package com.cinelink.federation.api.dto;

import com.cinelink.federation.graph.RatedMovie;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class UserMoviesResponse {
    private boolean success = true;
    private String user;
    private Integer born;

    @JsonProperty("movies_rated_count")
    private int moviesRatedCount;

    @JsonProperty("rated_movies")
    private List<RatedMovie> ratedMovies;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public Integer getBorn() {
        return born;
    }

    public void setBorn(Integer born) {
        this.born = born;
    }

    public int getMoviesRatedCount() {
        return moviesRatedCount;
    }

    public void setMoviesRatedCount(int moviesRatedCount) {
        this.moviesRatedCount = moviesRatedCount;
    }

    public List<RatedMovie> getRatedMovies() {
        return ratedMovies;
    }

    public void setRatedMovies(List<RatedMovie> ratedMovies) {
        this.ratedMovies = ratedMovies;
    }
}
