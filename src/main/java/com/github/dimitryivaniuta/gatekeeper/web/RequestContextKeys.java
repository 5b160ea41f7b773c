package com.github.dimitryivaniuta.gatekeeper.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CORRELATION_ID_ATTRIBUTE = RequestContextKeys.class.getName() + ".correlationId";

    // PipelineOutcome of an admitted request, for handlers that want the state trail
    public static final String GATEKEEPER_OUTCOME_ATTRIBUTE = RequestContextKeys.class.getName() + ".gatekeeperOutcome";

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_REAL_IP = "X-Real-IP";
}
