package com.fixfinder.backend.user;

public enum Role {
    CLIENT,
    PROFESSIONAL,
    ADMIN
}
