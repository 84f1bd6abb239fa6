package com.example.boundary.isolation.vocabulary;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed vocabulary of category terms that may appear in a couples view.
 * Field values outside the vocabulary never leave a partner's context.
 */
public final class CategoryVocabulary {

    public static final String THEMES = "themes";
    public static final String ATTACHMENT_PATTERNS = "attachment_patterns";
    public static final String FRAMEWORKS = "frameworks";
    public static final String DEFENSE_PATTERNS = "defense_patterns";
    public static final String COMMUNICATION_PATTERNS = "communication_patterns";
    public static final String MODALITIES = "modalities";

    private static final Set<String> ATTACHMENT_TERMS = Set.of(
            "secure attachment", "anxious attachment", "avoidant attachment", "disorganized attachment",
            "fearful avoidant", "dismissive avoidant", "anxious-preoccupied", "attachment anxiety",
            "attachment avoidance");

    private static final Set<String> FRAMEWORK_TERMS = Set.of(
            // Gottman
            "gottman method", "gottman four horsemen", "criticism", "contempt", "defensiveness",
            "stonewalling", "repair attempts", "love maps", "fondness and admiration", "turning toward",
            "positive perspective", "manage conflict", "make life dreams come true", "create shared meaning",
            // EFT
            "emotionally focused therapy", "eft", "attachment theory", "pursue-withdraw cycle",
            "pursuer-distancer", "protest polka", "freeze and flee", "find the raw spots", "hold me tight",
            // CBT
            "cognitive behavioral therapy", "cbt", "cognitive distortions", "automatic thoughts",
            "core beliefs", "behavioral activation", "thought records",
            // DBT
            "dialectical behavior therapy", "dbt", "mindfulness", "distress tolerance", "emotion regulation",
            "interpersonal effectiveness", "wise mind", "radical acceptance",
            // other
            "internal family systems", "ifs", "parts work", "psychodynamic", "transactional analysis",
            "schema therapy", "somatic experiencing", "emdr", "narrative therapy", "solution focused");

    private static final Set<String> THEME_TERMS = Set.of(
            "communication", "trust", "intimacy", "boundaries", "conflict", "connection", "attachment",
            "safety", "vulnerability", "autonomy", "interdependence", "respect", "appreciation", "commitment",
            "values", "goals", "family of origin", "parenting", "finances", "work-life balance", "sexuality",
            "emotional attunement", "validation", "support", "independence");

    private static final Set<String> DEFENSE_TERMS = Set.of(
            "denial", "projection", "rationalization", "intellectualization", "displacement", "regression",
            "repression", "sublimation", "reaction formation", "splitting", "passive aggression", "avoidance",
            "minimization", "externalization");

    private static final Set<String> COMMUNICATION_TERMS = Set.of(
            "passive", "aggressive", "passive-aggressive", "assertive", "avoidant", "confrontational",
            "placating", "blaming", "computing", "distracting", "leveling", "demand-withdraw",
            "mutual avoidance", "mutual engagement",
            // Gottman horsemen are tracked as communication patterns too
            "criticism", "contempt", "defensiveness", "stonewalling");

    private static final Set<String> MODALITY_TERMS = Set.of(
            "cbt", "dbt", "eft", "emdr", "ifs", "mindfulness", "psychodynamic", "gottman", "narrative",
            "solution focused", "somatic", "art therapy", "play therapy", "trauma focused",
            "acceptance and commitment therapy", "act");

    private static final Map<String, Set<String>> TERMS_BY_FIELD = Map.of(
            THEMES, THEME_TERMS,
            ATTACHMENT_PATTERNS, ATTACHMENT_TERMS,
            FRAMEWORKS, FRAMEWORK_TERMS,
            DEFENSE_PATTERNS, DEFENSE_TERMS,
            COMMUNICATION_PATTERNS, COMMUNICATION_TERMS,
            MODALITIES, MODALITY_TERMS);

    private CategoryVocabulary() {}

    @NonNull
    public static Set<String> categoryFields() {
        return TERMS_BY_FIELD.keySet();
    }

    /**
     * Maps a raw value onto a vocabulary term for the field. An exact match wins; otherwise the
     * longest term contained in the value is used. Values that match nothing are rejected.
     */
    @NonNull
    public static Optional<String> canonicalize(@NonNull String fieldName, @Nullable String rawValue) {
        Set<String> terms = TERMS_BY_FIELD.get(fieldName);
        if (terms == null || rawValue == null || rawValue.isBlank()) {
            return Optional.empty();
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (terms.contains(normalized)) {
            return Optional.of(normalized);
        }
        return terms.stream()
                .filter(term -> containsWord(normalized, term))
                .max(Comparator.comparingInt(String::length).thenComparing(Comparator.reverseOrder()));
    }

    /**
     * Canonicalizes every value, dropping unknown ones and keeping first-seen order.
     */
    @NonNull
    public static Set<String> canonicalizeAll(@NonNull String fieldName, @NonNull List<String> rawValues) {
        Set<String> result = new LinkedHashSet<>();
        for (String raw : rawValues) {
            canonicalize(fieldName, raw).ifPresent(result::add);
        }
        return result;
    }

    private static boolean containsWord(String text, String term) {
        int index = text.indexOf(term);
        while (index >= 0) {
            int end = index + term.length();
            boolean startOk = index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
            boolean endOk = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            index = text.indexOf(term, index + 1);
        }
        return false;
    }
}
