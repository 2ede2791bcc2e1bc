package com.cinelink.federation.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class HealthResponse {
    private StoreStatus mongodb;
    private StoreStatus neo4j;
    private String status;

    public StoreStatus getMongodb() {
        return mongodb;
    }

    public void setMongodb(StoreStatus mongodb) {
        this.mongodb = mongodb;
    }

    public StoreStatus getNeo4j() {
        return neo4j;
    }

    public void setNeo4j(StoreStatus neo4j) {
        this.neo4j = neo4j;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @JsonIgnore
    public boolean isHealthy() {
        return "healthy".equals(status);
    }

    public static class StoreStatus {
        private String status;
        private String error;

        public StoreStatus() {
        }

        public StoreStatus(String status, String error) {
            this.status = status;
            this.error = error;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }
    }
}
