package com.example.boundary.common.util;

import com.example.boundary.audit.exception.TransientLedgerException;
import com.example.boundary.context.exception.TransientStorageException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Retry conditions shared by the context store and audit ledger pipelines.
 */
public final class RetryUtils {

    private RetryUtils() {}

    /**
     * Retryable conditions:
     * - WebClientResponseException with 5xx status
     * - WebClientRequestException (connection level failure)
     * - TransientStorageException and TransientLedgerException
     * - Spring transient data access failures
     * - TimeoutException
     *
     * @param throwable the exception to check
     * @return true if the exception is retryable
     */
    public static boolean isRetryable(@NonNull Throwable throwable) {
        if (throwable instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException
                || throwable instanceof TransientStorageException
                || throwable instanceof TransientLedgerException
                || throwable instanceof TransientDataAccessException
                || throwable instanceof TimeoutException;
    }
}
