package com.example.inventorytasks.exception;

import lombok.Getter;

/**
 * A remote service (exchange rate provider, release API) could not be used.
 * {@link #isRetryable()} tells the task queue whether a later attempt may succeed.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String service;

    /**
     * HTTP status of the failed response, null when no response was received
     */
    private final Integer status;

    private final boolean retryable;

    private ExternalServiceException(String service, Integer status, boolean retryable, String detail, Throwable cause) {
        super("[" + service + "] " + detail, cause);
        this.service = service;
        this.status = status;
        this.retryable = retryable;
    }

    /**
     * No usable response: connection refused, timeout, open circuit breaker, empty body
     */
    public static ExternalServiceException unavailable(String service, String detail, Throwable cause) {
        return new ExternalServiceException(service, null, true, detail, cause);
    }

    public static ExternalServiceException unavailable(String service, String detail) {
        return unavailable(service, detail, null);
    }

    /**
     * The service answered with an error status. Client errors other than 408 and 429 are final.
     */
    public static ExternalServiceException httpError(String service, int status, String body) {
        var transientStatus = status >= 500 || status == 408 || status == 429;
        return new ExternalServiceException(service, status, transientStatus, "HTTP " + status + ": " + body, null);
    }

    /**
     * The response was well-formed but unusable, e.g. rates quoted in the wrong base currency
     */
    public static ExternalServiceException invalidResponse(String service, String detail) {
        return new ExternalServiceException(service, null, false, detail, null);
    }
}
