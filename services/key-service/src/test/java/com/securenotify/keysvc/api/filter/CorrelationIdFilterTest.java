package com.securenotify.keysvc.api.filter;

import com.securenotify.keysvc.shared.security.SecurityUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter(new SecurityUtils());

    @Test
    @DisplayName("A well-formed caller id is echoed and visible in the MDC during the request")
    void reusesCallerId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/keys/k/revoke");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "trace-42.a_b");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get("correlationId")));

        assertThat(seen.get()).isEqualTo("trace-42.a_b");
        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("trace-42.a_b");
        assertThat(MDC.get("correlationId")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"bad id with spaces", "line\nbreak", "<script>"})
    @DisplayName("Unsafe caller ids are replaced with a generated one")
    void replacesUnsafeId(String provided) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, provided);
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isNotEqualTo(provided)
                .matches("[0-9a-f-]{36}");
    }

    @Test
    @DisplayName("Overlong caller ids are replaced")
    void replacesOverlongId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "a".repeat(65));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).hasSize(36);
    }
}
