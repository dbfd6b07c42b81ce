package com.threadbox.backend.notification;

public enum NotificationType {
    NEW_MESSAGE,
    EDIT,
    SYSTEM
}
