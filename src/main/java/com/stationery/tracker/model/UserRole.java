package com.stationery.tracker.model;

public enum UserRole {
    ADMIN, STAFF
}
