package com.github.dimitryivaniuta.cmdb.workflow.client;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/** Adds the engine credentials and JSON negotiation headers to every request. */
public class ApiKeyHeaderInterceptor implements Interceptor {

    static final String API_KEY_HEADER = "X-N8N-API-KEY";

    private final String apiKey;
    private final String userAgent;

    public ApiKeyHeaderInterceptor(String apiKey, String userAgent) {
        this.apiKey = apiKey;
        this.userAgent = userAgent;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request().newBuilder()
                .header(API_KEY_HEADER, apiKey)
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
        return chain.proceed(request);
    }
}
