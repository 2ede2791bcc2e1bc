package com.cinelink.federation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class CommonMoviesResponse {
    private boolean success = true;

    @JsonProperty("mongodb_count")
    private int mongodbCount;

    @JsonProperty("neo4j_count")
    private int neo4jCount;

    @JsonProperty("common_count")
    private int commonCount;

    @JsonProperty("common_movies")
    private List<String> commonMovies;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public int getMongodbCount() {
        return mongodbCount;
    }

    public void setMongodbCount(int mongodbCount) {
        this.mongodbCount = mongodbCount;
    }

    public int getNeo4jCount() {
        return neo4jCount;
    }

    public void setNeo4jCount(int neo4jCount) {
        this.neo4jCount = neo4jCount;
    }

    public int getCommonCount() {
        return commonCount;
    }

    public void setCommonCount(int commonCount) {
        this.commonCount = commonCount;
    }

    public List<String> getCommonMovies() {
        return commonMovies;
    }

    public void setCommonMovies(List<String> commonMovies) {
        this.commonMovies = commonMovies;
    }
}
