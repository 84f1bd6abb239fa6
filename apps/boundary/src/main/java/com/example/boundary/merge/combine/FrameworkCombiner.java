package com.example.boundary.merge.combine;

import com.example.boundary.config.BoundaryProperties;
import com.example.boundary.isolation.model.AbstractedView;
import com.example.boundary.isolation.vocabulary.CategoryVocabulary;
import com.example.boundary.merge.model.MergedFrameworkView;
import com.example.boundary.merge.model.TopicMatch;
import com.example.boundary.merge.model.TopicMatch.MatchType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines two partners' couples-policy views into one framework-level view.
 *
 * <p>Only vocabulary terms survive. Shared terms become overlaps; known pattern pairings across the
 * two partners become complementary dynamics or conflict patterns; focus areas and exercises are
 * derived from those matches.
 */
@Component
public class FrameworkCombiner {

    private static final List<PatternPair> COMPLEMENTARY_PAIRS = List.of(
            new PatternPair("anxious attachment", "avoidant attachment",
                    "Classic pursuer-distancer dynamic",
                    "Understanding attachment needs and creating safety"),
            new PatternPair("passive", "aggressive",
                    "Communication style mismatch",
                    "Developing assertive communication skills"),
            new PatternPair("avoidant", "confrontational",
                    "Conflict engagement mismatch",
                    "Finding balanced conflict resolution approaches"),
            new PatternPair("intellectualization", "projection",
                    "Different defensive styles",
                    "Emotional awareness and vulnerability"));

    private static final List<PatternPair> CONFLICT_PAIRS = List.of(
            new PatternPair("stonewalling", "criticism",
                    "Gottman negative cycle",
                    "Breaking the criticism-withdrawal cycle"),
            new PatternPair("contempt", "defensiveness",
                    "Escalating negative cycle",
                    "Building fondness and admiration"),
            new PatternPair("demand-withdraw", "mutual avoidance",
                    "Communication breakdown",
                    "Creating safe engagement patterns"));

    private static final Set<String> POSITIVE_OVERLAP_THEMES = Set.of(
            "communication", "trust", "intimacy", "connection", "commitment", "values", "goals");

    private static final Set<String> ANXIOUS_PATTERNS = Set.of(
            "anxious attachment", "anxious-preoccupied", "attachment anxiety");
    private static final Set<String> AVOIDANT_PATTERNS = Set.of(
            "avoidant attachment", "dismissive avoidant", "fearful avoidant", "attachment avoidance");
    private static final Set<String> FOUR_HORSEMEN = Set.of(
            "criticism", "contempt", "defensiveness", "stonewalling");

    private static final Map<String, List<String>> EXERCISES = Map.of(
            "anxious-avoidant", List.of("Attachment awareness dialogue", "Safe haven practice"),
            "communication", List.of("Active listening practice", "Soft start-up exercise"),
            "conflict", List.of("Time-out protocol", "De-escalation breathing"),
            "trust", List.of("Trust-building actions list", "Transparency practice"),
            "intimacy", List.of("Love maps questionnaire", "Fondness and admiration sharing"));

    private final int maxFocusAreas;
    private final int maxExercises;

    public FrameworkCombiner(@NonNull BoundaryProperties properties) {
        this.maxFocusAreas = properties.getMerge().getMaxFocusAreas();
        this.maxExercises = properties.getMerge().getMaxExercises();
    }

    @NonNull
    public MergedFrameworkView combine(
            @NonNull String coupleId,
            @NonNull AbstractedView partnerA,
            @NonNull AbstractedView partnerB,
            @NonNull Instant createdAt) {

        Terms a = Terms.of(partnerA);
        Terms b = Terms.of(partnerB);

        List<TopicMatch> overlaps = findOverlaps(a, b);
        List<TopicMatch> complementary = findComplementary(a, b);
        List<TopicMatch> conflicts = findConflicts(a, b);

        SortedMap<String, List<String>> categories = new TreeMap<>();
        for (String field : CategoryVocabulary.categoryFields()) {
            Set<String> union = new TreeSet<>(a.get(field));
            union.addAll(b.get(field));
            if (!union.isEmpty()) {
                categories.put(field, List.copyOf(union));
            }
        }

        Map<String, Long> versions = new LinkedHashMap<>();
        versions.put(partnerA.clientId(), partnerA.contextVersion());
        versions.put(partnerB.clientId(), partnerB.contextVersion());

        return new MergedFrameworkView(
                coupleId,
                Collections.unmodifiableSortedMap(categories),
                overlaps,
                complementary,
                conflicts,
                focusAreas(overlaps, complementary, conflicts),
                exercises(a, b, conflicts),
                summary(overlaps, complementary, conflicts),
                Collections.unmodifiableMap(versions),
                createdAt);
    }

    private List<TopicMatch> findOverlaps(Terms a, Terms b) {
        List<TopicMatch> matches = new ArrayList<>();
        for (String theme : intersection(a.get(CategoryVocabulary.THEMES), b.get(CategoryVocabulary.THEMES))) {
            boolean positive = POSITIVE_OVERLAP_THEMES.contains(theme);
            matches.add(new TopicMatch(theme, MatchType.OVERLAP, positive ? 0.9 : 0.7,
                    "Both partners working on " + theme,
                    positive ? "Building shared " + theme : null));
        }
        for (String pattern : intersection(a.get(CategoryVocabulary.ATTACHMENT_PATTERNS),
                b.get(CategoryVocabulary.ATTACHMENT_PATTERNS))) {
            matches.add(new TopicMatch(pattern, MatchType.OVERLAP, 0.85,
                    "Shared attachment pattern: " + pattern, null));
        }
        for (String framework : intersection(a.get(CategoryVocabulary.FRAMEWORKS),
                b.get(CategoryVocabulary.FRAMEWORKS))) {
            matches.add(new TopicMatch(framework, MatchType.OVERLAP, 0.9,
                    "Both working with " + framework + " framework", null));
        }
        return List.copyOf(matches);
    }

    private List<TopicMatch> findComplementary(Terms a, Terms b) {
        Set<String> aPatterns = a.patterns(true);
        Set<String> bPatterns = b.patterns(true);
        List<TopicMatch> matches = new ArrayList<>();

        for (PatternPair pair : COMPLEMENTARY_PAIRS) {
            if (pair.spans(aPatterns, bPatterns)) {
                matches.add(new TopicMatch(pair.first() + " / " + pair.second(), MatchType.COMPLEMENTARY, 0.85,
                        pair.description(), pair.focusArea()));
            }
        }

        boolean exactPairFound = matches.stream()
                .anyMatch(m -> m.topic().equals("anxious attachment / avoidant attachment"));
        if (!exactPairFound && isAnxiousAvoidant(aPatterns, bPatterns, AVOIDANT_PATTERNS)) {
            matches.add(new TopicMatch("anxious-avoidant dynamic", MatchType.COMPLEMENTARY, 0.9,
                    "Classic pursuer-distancer attachment pattern",
                    "Understanding attachment needs and creating safety"));
        }
        return List.copyOf(matches);
    }

    private List<TopicMatch> findConflicts(Terms a, Terms b) {
        Set<String> aPatterns = a.patterns(false);
        Set<String> bPatterns = b.patterns(false);
        List<TopicMatch> matches = new ArrayList<>();

        for (PatternPair pair : CONFLICT_PAIRS) {
            if (pair.spans(aPatterns, bPatterns)) {
                matches.add(new TopicMatch(pair.first() + " + " + pair.second(), MatchType.CONFLICT, 0.8,
                        pair.description(), pair.focusArea()));
            }
        }

        Set<String> aHorsemen = intersection(aPatterns, FOUR_HORSEMEN);
        Set<String> bHorsemen = intersection(bPatterns, FOUR_HORSEMEN);
        if (aHorsemen.size() >= 2 || bHorsemen.size() >= 2) {
            Set<String> combined = new TreeSet<>(aHorsemen);
            combined.addAll(bHorsemen);
            matches.add(new TopicMatch("gottman four horsemen", MatchType.CONFLICT, 0.85,
                    "Negative patterns present: " + String.join(", ", combined), null));
        }
        return List.copyOf(matches);
    }

    private List<String> focusAreas(List<TopicMatch> overlaps, List<TopicMatch> complementary,
                                    List<TopicMatch> conflicts) {
        Set<String> areas = new LinkedHashSet<>();
        for (List<TopicMatch> group : List.of(complementary, conflicts, overlaps)) {
            group.stream()
                    .map(TopicMatch::focusArea)
                    .filter(area -> area != null)
                    .forEach(areas::add);
        }
        return areas.stream().limit(maxFocusAreas).toList();
    }

    private List<String> exercises(Terms a, Terms b, List<TopicMatch> conflicts) {
        Set<String> exercises = new LinkedHashSet<>();

        // the exercise trigger ignores "attachment avoidance", unlike the dynamic detection
        Set<String> avoidantForExercises = Set.of("avoidant attachment", "dismissive avoidant", "fearful avoidant");
        if (isAnxiousAvoidant(a.get(CategoryVocabulary.ATTACHMENT_PATTERNS),
                b.get(CategoryVocabulary.ATTACHMENT_PATTERNS), avoidantForExercises)) {
            exercises.addAll(EXERCISES.get("anxious-avoidant"));
        }

        Set<String> themes = new HashSet<>(a.get(CategoryVocabulary.THEMES));
        themes.addAll(b.get(CategoryVocabulary.THEMES));
        for (String theme : List.of("communication", "trust", "intimacy")) {
            if (themes.contains(theme)) {
                exercises.addAll(EXERCISES.get(theme));
            }
        }
        if (!conflicts.isEmpty()) {
            exercises.addAll(EXERCISES.get("conflict"));
        }
        return exercises.stream().limit(maxExercises).toList();
    }

    private static String summary(List<TopicMatch> overlaps, List<TopicMatch> complementary,
                                  List<TopicMatch> conflicts) {
        List<String> parts = new ArrayList<>();
        if (!overlaps.isEmpty()) {
            parts.add(overlaps.size() + " shared theme(s)");
        }
        if (!complementary.isEmpty()) {
            parts.add(complementary.size() + " complementary dynamic(s)");
        }
        if (!conflicts.isEmpty()) {
            parts.add(conflicts.size() + " potential conflict area(s)");
        }
        if (parts.isEmpty()) {
            return "No significant patterns identified between partners.";
        }
        return "Analysis identified: " + String.join(", ", parts) + ".";
    }

    private static boolean isAnxiousAvoidant(Set<String> a, Set<String> b, Set<String> avoidant) {
        boolean aAnxious = !intersection(a, ANXIOUS_PATTERNS).isEmpty();
        boolean bAnxious = !intersection(b, ANXIOUS_PATTERNS).isEmpty();
        boolean aAvoidant = !intersection(a, avoidant).isEmpty();
        boolean bAvoidant = !intersection(b, avoidant).isEmpty();
        return (aAnxious && bAvoidant) || (bAnxious && aAvoidant);
    }

    private static Set<String> intersection(Set<String> left, Set<String> right) {
        Set<String> shared = new TreeSet<>(left);
        shared.retainAll(right);
        return shared;
    }

    private record PatternPair(String first, String second, String description, String focusArea) {

        boolean spans(Set<String> a, Set<String> b) {
            return (a.contains(first) && b.contains(second)) || (a.contains(second) && b.contains(first));
        }
    }

    /**
     * One partner's view reduced to canonical vocabulary terms per category field.
     */
    private record Terms(Map<String, Set<String>> byField) {

        static Terms of(AbstractedView view) {
            Map<String, Set<String>> byField = new LinkedHashMap<>();
            for (String field : CategoryVocabulary.categoryFields()) {
                byField.put(field, CategoryVocabulary.canonicalizeAll(field, view.values(field)));
            }
            return new Terms(byField);
        }

        Set<String> get(String field) {
            return byField.getOrDefault(field, Set.of());
        }

        Set<String> patterns(boolean includeAttachment) {
            Set<String> patterns = new HashSet<>();
            if (includeAttachment) {
                patterns.addAll(get(CategoryVocabulary.ATTACHMENT_PATTERNS));
            }
            patterns.addAll(get(CategoryVocabulary.COMMUNICATION_PATTERNS));
            patterns.addAll(get(CategoryVocabulary.DEFENSE_PATTERNS));
            return patterns;
        }
    }
}
