package com.cinelink.federation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class MovieUpdateResponse {
    private boolean success = true;
    private String message;

    @JsonProperty("modified_count")
    private long modifiedCount;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public long getModifiedCount() {
        return modifiedCount;
    }

    public void setModifiedCount(long modifiedCount) {
        this.modifiedCount = modifiedCount;
    }
}
