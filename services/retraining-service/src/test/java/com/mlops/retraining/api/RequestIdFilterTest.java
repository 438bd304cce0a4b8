package com.mlops.retraining.api;

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

class RequestIdFilterTest {

    @Test
    void exposesIdsToHandlerAndClearsMdcAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/retrain");
        request.addHeader("x-request-id", " req-1 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();
        AtomicReference<String> seenTraceId = new AtomicReference<>();
        AtomicReference<String> handlerTraceId = new AtomicReference<>();

        new RequestIdFilter().doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(
                HttpServletRequest req,
                HttpServletResponse res
            ) {
                seenRequestId.set(MDC.get(RequestIdFilter.REQUEST_MDC_KEY));
                seenTraceId.set(MDC.get(RequestIdFilter.TRACE_MDC_KEY));
                handlerTraceId.set(RequestIdUtil.traceId(req));
            }
        }));

        assertThat(seenRequestId.get()).isEqualTo("req-1");
        assertThat(response.getHeader("x-request-id")).isEqualTo("req-1");
        assertThat(seenTraceId.get()).isNotBlank().doesNotContain("-");
        assertThat(handlerTraceId.get()).isEqualTo(seenTraceId.get());
        assertThat(response.getHeader("x-trace-id")).isEqualTo(seenTraceId.get());
        assertThat(MDC.get(RequestIdFilter.REQUEST_MDC_KEY)).isNull();
        assertThat(MDC.get(RequestIdFilter.TRACE_MDC_KEY)).isNull();
    }

    @Test
    void blankHeaderGetsGeneratedIdReusedWithinRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/retrain/status");
        request.addHeader("x-trace-id", "   ");

        String first = RequestIdUtil.traceId(request);
        String second = RequestIdUtil.traceId(request);

        assertThat(first).hasSize(32).isEqualTo(second);
        assertThat(RequestIdUtil.requestId(request)).isNotEqualTo(first);
    }
}
