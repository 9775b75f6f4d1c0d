package com.webapp.authservice.entity;

public enum NotificationType {
    LIKE,
    COMMENT,
    FOLLOW,
    MENTION,
    POST,
    SYSTEM
}
