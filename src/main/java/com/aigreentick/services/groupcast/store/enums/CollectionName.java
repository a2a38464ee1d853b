package com.aigreentick.services.groupcast.store.enums;

public enum CollectionName {

    CAMPAIGNS("campaigns"),
    GROUPS("groups"),
    STATISTICS("statistics"),
    SETTINGS("settings");

    private final String key;

    CollectionName(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
