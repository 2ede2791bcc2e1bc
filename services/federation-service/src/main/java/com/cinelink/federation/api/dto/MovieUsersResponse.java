package com.cinelink.federation.api.dto;

import com.cinelink.federation.graph.Reviewer;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class MovieUsersResponse {
    private boolean success = true;
    private String movie;

    @JsonProperty("users_count")
    private int usersCount;

    private List<Reviewer> users;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMovie() {
        return movie;
    }

    public void setMovie(String movie) {
        this.movie = movie;
    }

    public int getUsersCount() {
        return usersCount;
    }

    public void setUsersCount(int usersCount) {
        this.usersCount = usersCount;
    }

    public List<Reviewer> getUsers() {
        return users;
    }

    public void setUsers(List<Reviewer> users) {
        this.users = users;
    }
}
