package com.casework.core.model;

public enum NotificationKind {
    SLA_BREACHED,
    TRANSITION,
    ASSIGNED
}
