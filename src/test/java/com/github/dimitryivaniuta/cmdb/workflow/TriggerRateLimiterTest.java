package com.github.dimitryivaniuta.cmdb.workflow;

import com.github.dimitryivaniuta.cmdb.error.RateLimitExceededException;
import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.web.ApiProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerRateLimiterTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void eleventhTriggerWithinAMinuteIsRejected() {
        TriggerRateLimiter limiter = new TriggerRateLimiter(new ApiProperties(), new CmdbMetrics(registry));
        MockHttpServletRequest request = requestFromUser("alice");

        for (int i = 0; i < 10; i++) {
            limiter.check(request);
        }

        assertThatThrownBy(() -> limiter.check(request))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        ex -> assertThat(ex.getRetryAfterSeconds()).isEqualTo(60));
        assertThat(registry.get("cmdb_workflow_trigger_rejected_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void callersAreLimitedIndependently() {
        ApiProperties props = new ApiProperties();
        props.getTriggerRateLimit().setPermitsPerMinute(1);
        TriggerRateLimiter limiter = new TriggerRateLimiter(props, new CmdbMetrics(registry));

        limiter.check(requestFromUser("alice"));

        assertThatCode(() -> limiter.check(requestFromUser("bob"))).doesNotThrowAnyException();
        assertThatThrownBy(() -> limiter.check(requestFromUser("alice")))
                .isInstanceOf(RateLimitExceededException.class);
    }

    @Test
    void disabledLimiterLetsEverythingThrough() {
        ApiProperties props = new ApiProperties();
        props.getTriggerRateLimit().setEnabled(false);
        props.getTriggerRateLimit().setPermitsPerMinute(1);
        TriggerRateLimiter limiter = new TriggerRateLimiter(props, new CmdbMetrics(registry));

        assertThatCode(() -> {
            for (int i = 0; i < 5; i++) {
                limiter.check(requestFromUser("alice"));
            }
        }).doesNotThrowAnyException();
    }

    @Test
    void subjectPrefersUserThenForwardedForThenRemoteAddress() {
        MockHttpServletRequest anonymous = new MockHttpServletRequest();
        anonymous.setRemoteAddr("10.1.2.3");
        assertThat(TriggerRateLimiter.subjectOf(anonymous)).isEqualTo("ip:10.1.2.3");

        anonymous.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        assertThat(TriggerRateLimiter.subjectOf(anonymous)).isEqualTo("ip:203.0.113.7");

        anonymous.addHeader("X-User-Id", " carol ");
        assertThat(TriggerRateLimiter.subjectOf(anonymous)).isEqualTo("user:carol");
    }

    private static MockHttpServletRequest requestFromUser(String user) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/workflows/1/trigger");
        request.addHeader("X-User-Id", user);
        return request;
    }
}
