package com.example.boundary.query.service;

import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.merge.engine.MergeEngine;
import com.example.boundary.query.model.ResearchResult;
import com.example.boundary.query.research.ResearchQueryBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Merge a couple, then ask the analytical service about the merged patterns.
 * Questions are sent one at a time, in order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearchService {

    private final MergeEngine mergeEngine;
    private final ResearchQueryBuilder queryBuilder;
    private final OutboundQueryService outboundQueryService;

    public Mono<ResearchResult> research(@NonNull String coupleId, @NonNull Actor actor) {
        return mergeEngine.merge(coupleId, actor)
                .flatMap(merge -> {
                    if (!merge.isCompleted()) {
                        return Mono.just(new ResearchResult(merge, List.of()));
                    }
                    List<String> questions = queryBuilder.build(merge.view());
                    log.info("Running {} research queries for couple {}",
                            questions.size(), StringSanitizer.forLog(coupleId));
                    return Flux.fromIterable(questions)
                            .concatMap(question -> outboundQueryService.sanitizeAndQuery(question, actor)
                                    .map(result -> new ResearchResult.Answer(question, result)))
                            .collectList()
                            .map(answers -> new ResearchResult(merge, answers));
                });
    }
}
