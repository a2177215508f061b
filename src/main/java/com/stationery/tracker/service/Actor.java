package com.stationery.tracker.service;

public record Actor(Long userId, String username) {

    public static final Actor SYSTEM = new Actor(null, "SYSTEM");

    public boolean isSystem() {
        return userId == null;
    }
}
