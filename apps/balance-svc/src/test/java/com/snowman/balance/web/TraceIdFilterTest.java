package com.snowman.balance.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void propagatesTraceAndUserIntoMdcForTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/users/42/balances/gold/adjustments");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "trace-7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenTrace = new AtomicReference<>();
        AtomicReference<String> seenUser = new AtomicReference<>();
        AtomicReference<String> seenContext = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seenTrace.set(MDC.get(TraceIdFilter.MDC_KEY));
                seenUser.set(MDC.get(TraceIdFilter.USER_MDC_KEY));
                seenContext.set(RequestContextHolder.currentTraceId());
            }
        });

        assertThat(seenTrace.get()).isEqualTo("trace-7");
        assertThat(seenUser.get()).isEqualTo("42");
        assertThat(seenContext.get()).isEqualTo("trace-7");
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("trace-7");
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
        assertThat(MDC.get(TraceIdFilter.USER_MDC_KEY)).isNull();
    }

    @Test
    void generatesTraceIdWhenHeaderMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/healthz"), response, new MockFilterChain());

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isNotBlank();
    }

    @Test
    void extractsUserIdOnlyFromUserPaths() {
        assertThat(TraceIdFilter.userIdFromPath("/users/7")).contains("7");
        assertThat(TraceIdFilter.userIdFromPath("/users/7/history")).contains("7");
        assertThat(TraceIdFilter.userIdFromPath("/users/abc/balances")).isEmpty();
        assertThat(TraceIdFilter.userIdFromPath("/healthz")).isEmpty();
        assertThat(TraceIdFilter.userIdFromPath(null)).isEmpty();
    }
}
