package com.realdonation.registry.infrastructure.web;

import com.realdonation.observability.CorrelationContext;
import com.realdonation.observability.CorrelationContextHolder;
import com.realdonation.security.Address;
import com.realdonation.security.CallerAddressExtractor;
import com.realdonation.security.testing.TestAccounts;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private CorrelationContext captureDuring(MockHttpServletRequest request) throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain chain = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return captured.get();
    }

    @Test
    @DisplayName("generates a correlation id when none is provided")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("propagates the client's correlation id")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("records the caller address and a request id while the chain runs")
    void recordsCaller() throws Exception {
        Address caller = TestAccounts.DONOR;
        var request = new MockHttpServletRequest();
        request.addHeader(CallerAddressExtractor.HEADER, caller.toHex());

        CorrelationContext context = captureDuring(request);

        assertThat(context.callerAddress()).isEqualTo(caller.toHex());
        assertThat(context.requestId()).isNotBlank();
    }

    @Test
    @DisplayName("leaves the caller empty for a malformed header")
    void malformedCallerIsIgnored() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CallerAddressExtractor.HEADER, "not-an-address");

        CorrelationContext context = captureDuring(request);

        assertThat(context.callerAddress()).isNull();
    }

    @Test
    @DisplayName("copies span and trace ids from the active span")
    void recordsActiveSpan() throws Exception {
        try (SdkTracerProvider tracerProvider = SdkTracerProvider.builder().build()) {
            Span span = tracerProvider.get("test").spanBuilder("http-request").startSpan();
            CorrelationContext context;
            try (Scope ignored = span.makeCurrent()) {
                context = captureDuring(new MockHttpServletRequest());
            } finally {
                span.end();
            }

            assertThat(context.spanId()).isEqualTo(span.getSpanContext().getSpanId());
            assertThat(context.traceId()).isEqualTo(span.getSpanContext().getTraceId());
        }
    }

    @Test
    @DisplayName("leaves span and trace ids empty without an active span")
    void noActiveSpan() throws Exception {
        CorrelationContext context = captureDuring(new MockHttpServletRequest());

        assertThat(context.spanId()).isNull();
        assertThat(context.traceId()).isNull();
    }

    @Test
    @DisplayName("clears the context after the request completes")
    void clearsContext() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> { });

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
