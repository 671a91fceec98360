package com.fixfinder.backend.notification;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
