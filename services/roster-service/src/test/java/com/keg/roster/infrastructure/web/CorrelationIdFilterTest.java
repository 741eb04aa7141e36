package com.keg.roster.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.keg.observability.CorrelationContext;
import com.keg.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a correlation ID when the client sends none")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("echoes the correlation ID sent by the client")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "roster-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("roster-abc-123");
    }

    @Test
    @DisplayName("replaces correlation IDs that could forge log lines")
    void replacesUnsafeCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc\nINFO fake entry");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isNotBlank()
                .doesNotContain("fake");
        assertThat(CorrelationIdFilter.acceptOrGenerate("x".repeat(65))).hasSizeLessThan(65);
    }

    @Test
    @DisplayName("exposes an http context while the chain runs and clears it afterwards")
    void scopesContextToRequest() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain chain = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "during-chain");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(captured.get().correlationId()).isEqualTo("during-chain");
        assertThat(captured.get().origin()).isEqualTo(CorrelationIdFilter.ORIGIN);
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
