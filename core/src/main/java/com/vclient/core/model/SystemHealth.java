package com.vclient.core.model;

/** {@code GET /health}: status of the API's backing stores. */
public record SystemHealth(String databaseStatus, String cacheStatus, String version) {
    public boolean isOnline() {
        return "online".equalsIgnoreCase(databaseStatus) && "online".equalsIgnoreCase(cacheStatus);
    }
}
