package com.webapp.authservice.entity;

public enum NotificationStatus {
    UNREAD,
    READ,
    ARCHIVED
}
