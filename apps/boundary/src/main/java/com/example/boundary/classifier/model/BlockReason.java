package com.example.boundary.classifier.model;

public enum BlockReason {
    PHI_DETECTED,
    DETECTION_FAILURE
}
