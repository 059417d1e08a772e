package io.abrserver.model;

public enum NotificationTarget {
    STATE("state"),
    ASSET_CACHE("asset-cache-update");

    private final String wireName;

    NotificationTarget(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
