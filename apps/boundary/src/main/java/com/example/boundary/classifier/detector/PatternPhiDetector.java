package com.example.boundary.classifier.detector;

import com.example.boundary.classifier.model.DetectedSpan;
import com.example.boundary.classifier.model.PhiCategory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex and heuristic identifier detection.
 *
 * <p>Name patterns are case sensitive on the name itself so that lower-case prose is not mistaken
 * for names; keyword prefixes ("client", "my wife", "DOB") match in any case. Candidate names made
 * only of clinical vocabulary are ignored. Overlapping detections are reduced to one span, keeping
 * the higher-priority category and then the longer match.
 */
@Component
public class PatternPhiDetector implements PhiDetector {

    private static final String PHI_GROUP = "phi";

    private static final String MONTH =
            "(?:January|February|March|April|May|June|July|August|September|October|November|December)";
    private static final String WEEKDAY = "(?:Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday)";
    private static final String DATE_VALUE = "(?:\\d{4}-\\d{2}-\\d{2}"
            + "|\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}"
            + "|(?i:" + MONTH + ")\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s*\\d{4}"
            + "|\\d{1,2}\\s+(?i:" + MONTH + ")\\s+\\d{4})";

    private static final Set<String> CLINICAL_TERMS = Set.of(
            "avoidant", "attachment", "anxious", "secure", "disorganized",
            "cognitive", "behavioral", "therapy", "intervention", "interventions", "technique", "techniques",
            "stonewalling", "criticism", "contempt", "defensiveness",
            "gottman", "four", "horsemen", "patterns", "skills", "emotion",
            "regulation", "dbt", "cbt", "eft", "emdr", "mindfulness",
            "intellectualization", "projection", "denial", "rationalization",
            "depression", "anxiety", "ptsd", "trauma", "disorder",
            "research", "evidence", "based", "clinical", "therapeutic",
            "couples", "relationship", "dynamic", "pursuer", "distancer",
            "parent", "child", "enmeshment", "codependency", "boundary",
            "emotionally", "focused", "method", "internal", "family", "systems", "dialectical", "behavior");

    private static final Set<String> STREET_SUFFIXES = Set.of(
            "street", "st", "avenue", "ave", "road", "rd", "boulevard", "blvd",
            "drive", "dr", "lane", "ln", "court", "ct", "way", "place", "pl");

    private static final Set<String> PLACE_NAMES = Set.of("New York", "Los Angeles", "San Francisco");

    private static final Pattern CAPITALIZED_PAIR = Pattern.compile("\\b([A-Z][a-z]+)\\s+([A-Z][a-z]+)\\b");

    private static final List<Rule> RULES = List.of(
            // social security numbers
            rule(PhiCategory.SSN, "\\b\\d{3}-\\d{2}-\\d{4}\\b"),
            rule(PhiCategory.SSN, "(?i:\\b(?:ssn|social security(?: number)?))[:\\s#]*\\d{3}[-\\s]?\\d{2}[-\\s]?\\d{4}\\b"),
            rule(PhiCategory.SSN, "\\b\\d{9}\\b"),

            // medical record numbers
            rule(PhiCategory.MEDICAL_RECORD_NUMBER,
                    "(?i:\\b(?:MRN|medical record(?: number)?|patient id))[:\\s#]*[A-Za-z0-9-]*\\d[A-Za-z0-9-]*\\b"),

            rule(PhiCategory.EMAIL, "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),

            rule(PhiCategory.PHONE, "\\b\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b"),
            rule(PhiCategory.PHONE, "\\(\\d{3}\\)\\s*\\d{3}[-.\\s]?\\d{4}\\b"),

            rule(PhiCategory.DATE_OF_BIRTH,
                    "(?i:\\b(?:DOB|D\\.O\\.B\\.?|date of birth|birth ?date|born on|born))[:\\s,]*" + DATE_VALUE),

            // ICD-10 / DSM codes: prefixed, or a bare ICD-10 code with a decimal part
            rule(PhiCategory.DIAGNOSTIC_CODE,
                    "(?i:\\b(?:ICD-?10(?:-CM)?|ICD|DSM-?(?:5|IV)(?:-TR)?|DSM|diagnosis code|dx))[:\\s#-]*"
                            + "(?:[A-Za-z]\\d{2}(?:\\.\\d{1,4})?|\\d{3}\\.\\d{1,2})\\b"),
            rule(PhiCategory.DIAGNOSTIC_CODE, "\\b[A-TV-Z]\\d{2}\\.\\d{1,4}\\b"),

            // explicit self-disclosure phrases
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bmy\\s+(?:full\\s+)?name\\s+is\\b"),
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bI\\s+live\\s+(?:at|in)\\b"),
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bmy\\s+(?:social\\s+security|SSN)\\b"),
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bmy\\s+(?:phone|cell|mobile)\\s+(?:number|#)\\b"),
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bmy\\s+email\\s+(?:is|address)\\b"),
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bborn\\s+on\\b"),
            rule(PhiCategory.SELF_DISCLOSURE, "(?i)\\bmy\\s+birthday\\b"),

            rule(PhiCategory.DATE, "\\b" + DATE_VALUE + "\\b"),
            rule(PhiCategory.DATE, "(?i)\\b(?:last|on|this past)\\s+" + WEEKDAY + "\\b"),

            rule(PhiCategory.LOCATION,
                    "\\b\\d+\\s+[A-Z][a-z]+\\s+(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Drive|Dr|Lane|Ln|Court|Ct)\\b"),
            rule(PhiCategory.LOCATION,
                    "\\b[A-Z][a-z]+\\s+(?:Street|Avenue|Road|Boulevard|Blvd|Drive|Lane|Court)\\b"),
            rule(PhiCategory.LOCATION, "\\b[A-Z][a-z]+,\\s*[A-Z]{2}\\s+\\d{5}(?:-\\d{4})?\\b"),
            rule(PhiCategory.LOCATION, "\\b(?i:at)\\s+[A-Z][a-z]+\\s+(?:Hospital|Medical Center|Clinic)\\b"),

            rule(PhiCategory.AGE, "(?i)\\b(?:I am|I'm|he is|she is|they are|he's|she's)\\s+\\d{1,3}\\s+years?\\s+old\\b"),
            rule(PhiCategory.AGE, "(?i)\\bmy\\s+\\d{1,2}[-\\s]?year[-\\s]?old\\b"),
            rule(PhiCategory.AGE, "(?i)\\baged?\\s+\\d{1,3}\\b"),

            rule(PhiCategory.NAME, "\\b(?:Mr|Mrs|Ms|Dr)\\.\\s+(?<phi>[A-Z][a-z]+)\\b"),
            rule(PhiCategory.NAME, "(?i:\\bmy\\s+(?:husband|wife|partner|mother|father|son|daughter|brother|sister))"
                    + "\\s+(?<phi>[A-Z][a-z]+)\\b"),
            rule(PhiCategory.NAME, "(?i:\\b(?:patient|client))\\s+(?<phi>[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\b"),
            rule(PhiCategory.NAME, "(?i:\\bnamed?)\\s+(?<phi>[A-Z][a-z]+)\\b"),
            rule(PhiCategory.NAME, "\\b(?<phi>[A-Z][a-z]+\\s+and\\s+[A-Z][a-z]+)'s\\b"),
            rule(PhiCategory.NAME, "\\b(?<phi>[A-Z][a-z]+)'s\\s+(?i:attachment|anxiety|depression|issues?|therapy)\\b"),

            // verbatim quotes
            rule(PhiCategory.QUOTE, "\"[^\"]{20,}\""),
            rule(PhiCategory.QUOTE, "\u201C[^\u201D]{20,}\u201D"),
            rule(PhiCategory.QUOTE, "(?<![A-Za-z])'[^']{20,}'"),
            rule(PhiCategory.QUOTE, "(?i)\\b(?:he|she|they)\\s+said[,:]?\\s+[\"'\u201C][^\"'\u201D]+[\"'\u201D]")
    );

    @Override
    @NonNull
    public List<DetectedSpan> detect(@NonNull String text) {
        List<DetectedSpan> candidates = new ArrayList<>();

        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                int start = rule.hasPhiGroup() ? matcher.start(PHI_GROUP) : matcher.start();
                int end = rule.hasPhiGroup() ? matcher.end(PHI_GROUP) : matcher.end();
                if (rule.category() == PhiCategory.NAME && isClinicalPhrase(text.substring(start, end))) {
                    continue;
                }
                candidates.add(new DetectedSpan(rule.category(), start, end));
            }
        }

        detectCapitalizedNames(text, candidates);
        return resolveOverlaps(candidates);
    }

    /**
     * Two consecutive capitalized words are taken as a personal name unless both are clinical
     * vocabulary, the second is a street suffix, or the pair is a known place name.
     */
    private void detectCapitalizedNames(String text, List<DetectedSpan> candidates) {
        Matcher matcher = CAPITALIZED_PAIR.matcher(text);
        int from = 0;
        while (from < text.length() && matcher.find(from)) {
            String first = matcher.group(1).toLowerCase(Locale.ROOT);
            String second = matcher.group(2).toLowerCase(Locale.ROOT);
            boolean clinical = CLINICAL_TERMS.contains(first) && CLINICAL_TERMS.contains(second);
            boolean street = STREET_SUFFIXES.contains(second);
            boolean place = PLACE_NAMES.contains(matcher.group());
            if (!clinical && !street && !place) {
                candidates.add(new DetectedSpan(PhiCategory.NAME, matcher.start(), matcher.end()));
                from = matcher.end();
            } else {
                // let the second word pair with the next one
                from = matcher.start(2);
            }
        }
    }

    private static boolean isClinicalPhrase(String phrase) {
        String[] words = phrase.toLowerCase(Locale.ROOT).split("\\s+");
        for (String word : words) {
            if (!CLINICAL_TERMS.contains(word) && !word.equals("and")) {
                return false;
            }
        }
        return true;
    }

    private static List<DetectedSpan> resolveOverlaps(List<DetectedSpan> candidates) {
        List<DetectedSpan> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparing(DetectedSpan::category)
                .thenComparing(Comparator.comparingInt(DetectedSpan::length).reversed())
                .thenComparingInt(DetectedSpan::start));

        List<DetectedSpan> accepted = new ArrayList<>();
        for (DetectedSpan candidate : ordered) {
            if (accepted.stream().noneMatch(candidate::overlaps)) {
                accepted.add(candidate);
            }
        }
        accepted.sort(Comparator.comparingInt(DetectedSpan::start));
        return List.copyOf(accepted);
    }

    private static Rule rule(PhiCategory category, String regex) {
        return new Rule(category, Pattern.compile(regex), regex.contains("(?<" + PHI_GROUP + ">"));
    }

    private record Rule(PhiCategory category, Pattern pattern, boolean hasPhiGroup) {
    }
}
