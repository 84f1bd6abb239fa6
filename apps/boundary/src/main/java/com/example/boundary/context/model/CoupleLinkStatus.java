package com.example.boundary.context.model;

public enum CoupleLinkStatus {
    ACTIVE,
    PAUSED,
    TERMINATED
}
