package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.workflow.ratelimit.RequestRateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.Interceptor;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RateLimitInterceptorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void waitRoundsUpToWholeSeconds() {
        assertThat(RateLimitInterceptor.waitFor(NOW.plusMillis(1_200), NOW)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RateLimitInterceptor.waitFor(NOW.plusSeconds(5), NOW)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void waitIsAtLeastOneSecond() {
        assertThat(RateLimitInterceptor.waitFor(NOW, NOW)).isEqualTo(Duration.ofSeconds(1));
        assertThat(RateLimitInterceptor.waitFor(NOW.minusSeconds(3), NOW)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void unknownResetWaitsSixtySeconds() {
        assertThat(RateLimitInterceptor.waitFor(null, NOW)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void sleepsUntilLimiterGrantsASlot() throws IOException {
        RequestRateLimiter limiter = mock(RequestRateLimiter.class);
        when(limiter.tryAcquire()).thenReturn(false, false, true);
        when(limiter.getResetTime()).thenReturn(NOW.plusMillis(2_500));
        List<Duration> sleeps = new ArrayList<>();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        RateLimitInterceptor interceptor = new RateLimitInterceptor(limiter, clock, sleeps::add,
                new CmdbMetrics(new SimpleMeterRegistry()));

        Request request = new Request.Builder().url("http://n8n.local/api/v1/workflows").build();
        Response response = new Response.Builder()
                .request(request).protocol(Protocol.HTTP_1_1).code(200).message("OK").build();
        Interceptor.Chain chain = mock(Interceptor.Chain.class);
        when(chain.request()).thenReturn(request);
        when(chain.proceed(any())).thenReturn(response);

        assertThat(interceptor.intercept(chain)).isSameAs(response);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(3), Duration.ofSeconds(3));
        verify(chain).proceed(request);
    }
}
