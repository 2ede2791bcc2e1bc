package com.cinelink.federation.common;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class FederationRequestContextFilterTest {

    private final FederationRequestContextFilter filter = new FederationRequestContextFilter();

    @Test
    void bindsIncomingIdsForTheRequestAndEchoesThem() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/movies");
        request.addHeader("x-request-id", "req-42");
        request.addHeader("x-trace-id", "4bf92f3577b34da6a3ce929d0e0e4736");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();
        AtomicReference<String> seenMdcTraceId = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(
                HttpServletRequest req,
                HttpServletResponse res
            ) {
                seenRequestId.set(RequestContextHolder.requestId());
                seenMdcTraceId.set(MDC.get("trace_id"));
            }
        }));

        assertThat(seenRequestId.get()).isEqualTo("req-42");
        assertThat(seenMdcTraceId.get()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(response.getHeader("x-request-id")).isEqualTo("req-42");
        assertThat(response.getHeader("x-trace-id")).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
    }

    @Test
    void generatesIdsWhenAbsentAndClearsThemAfterwards() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/health"), response, new MockFilterChain());

        assertThat(response.getHeader("x-request-id")).startsWith("req_");
        assertThat(response.getHeader("x-trace-id")).hasSize(32);
        assertThat(RequestContextHolder.requestId()).isNull();
        assertThat(MDC.get("request_id")).isNull();
    }
}
