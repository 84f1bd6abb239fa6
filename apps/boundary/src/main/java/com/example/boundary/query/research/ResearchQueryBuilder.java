package com.example.boundary.query.research;

import com.example.boundary.isolation.vocabulary.CategoryVocabulary;
import com.example.boundary.merge.model.MergedFrameworkView;
import com.example.boundary.merge.model.TopicMatch;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds research questions for the analytical service from a merged couples view.
 *
 * <p>Questions are filled from fixed templates with vocabulary terms and match descriptions only,
 * and are lower-cased so that nothing reads as a proper name. Each question still goes through the
 * anonymization gate before it leaves the service.
 */
@Component
public class ResearchQueryBuilder {

    static final int MAX_QUERIES = 5;

    private static final String INTERVENTION = "evidence-based interventions for %s in therapy";
    private static final String TECHNIQUE = "therapeutic techniques for addressing %s";
    private static final String RESEARCH = "clinical research on %s in %s";
    private static final String COUPLES = "couples therapy approaches for %s patterns";
    private static final String ATTACHMENT = "treatment approaches for %s attachment in adults";

    @NonNull
    public List<String> build(@NonNull MergedFrameworkView view) {
        Set<String> queries = new LinkedHashSet<>();

        for (String framework : view.terms(CategoryVocabulary.FRAMEWORKS)) {
            queries.add(String.format(INTERVENTION, framework));
        }
        for (TopicMatch match : view.complementaryPatterns()) {
            queries.add(String.format(COUPLES, match.description()));
        }
        for (String pattern : view.terms(CategoryVocabulary.COMMUNICATION_PATTERNS)) {
            queries.add(String.format(TECHNIQUE, pattern));
        }
        for (String defense : view.terms(CategoryVocabulary.DEFENSE_PATTERNS)) {
            queries.add(String.format(RESEARCH, defense, "couples therapy"));
        }
        for (String style : view.terms(CategoryVocabulary.ATTACHMENT_PATTERNS)) {
            queries.add(String.format(ATTACHMENT, style.replace(" attachment", "")));
        }

        return queries.stream()
                .map(query -> query.toLowerCase(Locale.ROOT))
                .distinct()
                .limit(MAX_QUERIES)
                .toList();
    }
}
