package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Low-level JSON client for the n8n public REST API ({@code baseUrl + /api/v1 + path}).
 * Every call is rate limited and retried per {@link N8nRetryPolicy}; failures surface as
 * {@link N8nClientException}.
 */
@Slf4j
@Component
public class N8nApiClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String API_PREFIX = "/api/v1";

    private final OkHttpClient http;
    private final N8nProperties props;
    private final ObjectMapper mapper;
    private final N8nErrorClassifier classifier;
    private final Retry retry;

    public N8nApiClient(@Qualifier("n8nHttpClient") OkHttpClient http,
                        N8nProperties props,
                        ObjectMapper mapper,
                        N8nErrorClassifier classifier,
                        CmdbMetrics metrics) {
        this.http = http;
        this.props = props;
        this.mapper = mapper;
        this.classifier = classifier;
        this.retry = N8nRetryPolicy.from(props.getRetry()).toRetry("n8n");
        this.retry.getEventPublisher().onRetry(event -> {
            Throwable last = event.getLastThrowable();
            String code = last instanceof N8nClientException n ? n.getCode() : "UNKNOWN";
            metrics.n8nRetry(code);
            log.warn("[n8n] retrying request (attempt {}/{}) after {}ms: {}",
                    event.getNumberOfRetryAttempts(), props.getRetry().getMaxAttempts(),
                    event.getWaitInterval().toMillis(), last == null ? code : last.getMessage());
        });
    }

    public JsonNode get(String path, Map<String, ?> query) {
        HttpUrl.Builder url = apiUrl(path).newBuilder();
        if (query != null) {
            query.forEach((k, v) -> {
                if (v != null) url.addQueryParameter(k, String.valueOf(v));
            });
        }
        return execute(new Request.Builder().url(url.build()).get().build());
    }

    public JsonNode get(String path) {
        return get(path, Map.of());
    }

    public JsonNode post(String path, Object body) {
        Request request = new Request.Builder()
                .url(apiUrl(path))
                .post(RequestBody.create(write(body), JSON))
                .build();
        return execute(request);
    }

    /**
     * {@code GET baseUrl/healthz}, outside the API prefix and without retries.
     */
    public boolean healthCheck() {
        if (!props.isEnabled()) {
            return false;
        }
        Request request = new Request.Builder().url(baseUrl().newBuilder().addPathSegment("healthz").build()).get().build();
        try (Response response = http.newCall(request).execute()) {
            return response.code() == 200;
        } catch (IOException ex) {
            log.warn("[n8n] health check failed: {}", ex.toString());
            return false;
        }
    }

    private JsonNode execute(Request request) {
        if (!props.isEnabled()) {
            throw new N8nClientException(N8nClientException.CONNECTION_ERROR,
                    "n8n integration is disabled (cmdb.n8n.enabled=false)", null, false);
        }
        return retry.executeSupplier(() -> callOnce(request));
    }

    private JsonNode callOnce(Request request) {
        try (Response response = http.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw classifier.fromResponse(response.code(), text);
            }
            return text.isBlank() ? MissingNode.getInstance() : mapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new N8nClientException(N8nClientException.UPSTREAM_ERROR,
                    "n8n returned a malformed JSON body: " + ex.getOriginalMessage(), null, false, null, ex);
        } catch (IOException ex) {
            throw classifier.fromTransport(ex);
        }
    }

    private HttpUrl apiUrl(String path) {
        String clean = path.startsWith("/") ? path : "/" + path;
        HttpUrl url = HttpUrl.parse(trimTrailingSlash(props.getBaseUrl()) + API_PREFIX + clean);
        if (url == null) {
            throw new IllegalArgumentException("Invalid n8n URL for path " + path);
        }
        return url;
    }

    private HttpUrl baseUrl() {
        HttpUrl url = HttpUrl.parse(trimTrailingSlash(props.getBaseUrl()));
        if (url == null) {
            throw new IllegalStateException("Invalid cmdb.n8n.base-url " + props.getBaseUrl());
        }
        return url;
    }

    private String write(Object body) {
        try {
            return mapper.writeValueAsString(body == null ? Map.of() : body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String trimTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
