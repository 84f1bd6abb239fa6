package com.example.boundary.query.model;

import com.example.boundary.merge.model.MergeResult;
import org.springframework.lang.NonNull;

import java.util.List;

/**
 * A merge plus the research answers built from it. Answers are empty unless the merge completed.
 */
public record ResearchResult(
        @NonNull MergeResult merge,
        @NonNull List<Answer> answers
) {
    public ResearchResult {
        answers = List.copyOf(answers);
    }

    /**
     * One research question and what the outbound path did with it.
     */
    public record Answer(@NonNull String question, @NonNull QueryResult result) {
    }
}
