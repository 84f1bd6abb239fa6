package com.example.boundary.classifier.detector;

import com.example.boundary.classifier.model.DetectedSpan;
import org.springframework.lang.NonNull;

import java.util.List;

/**
 * Finds identifiers in free text.
 */
public interface PhiDetector {

    /**
     * @return non-overlapping spans ordered by start offset, empty when nothing was found
     */
    @NonNull
    List<DetectedSpan> detect(@NonNull String text);
}
