package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

@Slf4j
public class CallTimingInterceptor implements Interceptor {

    private final CmdbMetrics metrics;
    private final boolean verbose;

    public CallTimingInterceptor(CmdbMetrics metrics, boolean verbose) {
        this.metrics = metrics;
        this.verbose = verbose;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String method = request.method();
        String path = request.url().encodedPath();
        long start = System.nanoTime();
        try {
            Response response = chain.proceed(request);
            long nanos = System.nanoTime() - start;
            metrics.n8nRequest(method, response.code());
            metrics.recordDuration("cmdb_n8n_request_duration", method, nanos);
            if (verbose) {
                log.info("[n8n] {} {} -> {} ({}ms)", method, path, response.code(), nanos / 1_000_000);
            } else {
                log.debug("[n8n] {} {} -> {} ({}ms)", method, path, response.code(), nanos / 1_000_000);
            }
            return response;
        } catch (IOException ex) {
            long nanos = System.nanoTime() - start;
            metrics.n8nRequest(method, 0);
            metrics.recordDuration("cmdb_n8n_request_duration", method, nanos);
            log.warn("[n8n] {} {} failed after {}ms: {}", method, path, nanos / 1_000_000, ex.toString());
            throw ex;
        }
    }
}
