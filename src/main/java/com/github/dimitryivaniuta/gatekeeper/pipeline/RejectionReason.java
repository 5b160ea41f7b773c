package com.github.dimitryivaniuta.gatekeeper.pipeline;

import org.springframework.http.HttpStatus;

/**
 * Why a gate rejected a request. The tag goes into the response body's {@code error} field.
 */
public enum RejectionReason {
    INVALID_HOST("invalid_host", HttpStatus.BAD_REQUEST),
    RATE_LIMITED("rate_limited", HttpStatus.TOO_MANY_REQUESTS),
    FORBIDDEN_IP("unauthorized", HttpStatus.FORBIDDEN),
    UNAUTHORIZED_TOKEN("unauthorized", HttpStatus.UNAUTHORIZED),
    UNAVAILABLE("unavailable", HttpStatus.SERVICE_UNAVAILABLE);

    private final String tag;
    private final HttpStatus status;

    RejectionReason(String tag, HttpStatus status) {
        this.tag = tag;
        this.status = status;
    }

    public String tag() {
        return tag;
    }

    public HttpStatus status() {
        return status;
    }
}
