package com.example.boundary.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "boundary")
public class BoundaryProperties {

    private Audit audit = new Audit();
    private Merge merge = new Merge();
    private Classifier classifier = new Classifier();

    @Data
    public static class Audit {
        private String store = "in-memory";  // "in-memory" or "mongo"
        private Duration timeout = Duration.ofSeconds(2);
        private int maxAttempts = 3;  // total attempts, first write included
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Merge {
        private Duration lockWaitTimeout = Duration.ofSeconds(30);
        private int maxExercises = 6;
        private int maxFocusAreas = 5;
    }

    @Data
    public static class Classifier {
        private Duration scanTimeout = Duration.ofSeconds(2);
        private int maxInputLength = 20_000;
    }
}
