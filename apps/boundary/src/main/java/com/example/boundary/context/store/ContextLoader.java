package com.example.boundary.context.store;

import com.example.boundary.common.util.RetryUtils;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.config.properties.ContextStoreProperties;
import com.example.boundary.context.exception.TransientStorageException;
import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.model.CoupleLink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.function.Supplier;

/**
 * Reads from the context store with a per-attempt timeout and bounded backoff.
 * Exhausted retries surface as {@link TransientStorageException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextLoader {

    private final ContextStoreClient storeClient;
    private final ContextStoreProperties properties;

    public Mono<ClientContext> loadContext(@NonNull String clientId, @Nullable Long version) {
        return withResilience("context " + clientId, () -> storeClient.getContext(clientId, version));
    }

    public Mono<CoupleLink> loadCoupleLink(@NonNull String coupleId) {
        return withResilience("couple link " + coupleId, () -> storeClient.getCoupleLink(coupleId));
    }

    private <T> Mono<T> withResilience(String target, Supplier<Mono<T>> call) {
        ContextStoreProperties.RetryProperties retryConfig = properties.retry();
        String safeTarget = StringSanitizer.forLog(target, 128);

        return Mono.defer(call)
                .timeout(properties.timeout())
                .retryWhen(Retry.backoff(retryConfig.maxAttempts() - 1L, retryConfig.initialBackoff())
                        .maxBackoff(retryConfig.maxBackoff())
                        .filter(RetryUtils::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying context store read for {}, attempt {}: {}",
                                safeTarget, signal.totalRetries() + 2,
                                StringSanitizer.forLog(signal.failure().getMessage())))
                        .onRetryExhaustedThrow((spec, signal) -> new TransientStorageException(
                                "Context store unavailable after " + (signal.totalRetries() + 1) + " attempts",
                                signal.failure())));
    }
}
