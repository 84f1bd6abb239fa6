package com.example.boundary.classifier.model;

/**
 * Kinds of identifier the classifier looks for. Declaration order is the priority used
 * when two detections overlap: earlier wins.
 */
public enum PhiCategory {
    SSN,
    MEDICAL_RECORD_NUMBER,
    EMAIL,
    PHONE,
    DATE_OF_BIRTH,
    DIAGNOSTIC_CODE,
    SELF_DISCLOSURE,
    DATE,
    LOCATION,
    AGE,
    NAME,
    QUOTE
}
