package com.github.dimitryivaniuta.cmdb.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String DEFAULT_USER_ID = "system";
}
