package com.example.boundary.isolation.model;

public enum PolicyMode {
    STRICT,      // any unlisted requested field fails the extraction
    PERMISSIVE   // unlisted requested fields are dropped
}
