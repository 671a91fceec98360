package com.fixfinder.backend.job;

public enum Urgency {
    REGULAR,
    URGENT
}
