package com.webapp.authservice.entity;

public enum UserRole {
    ROLE_USER,
    ROLE_ADMIN
}
