package com.phillippitts.mediatoolbox.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcFilterTest {

    private static final String UUID_PATTERN =
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        response = new MockHttpServletResponse();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdFromHeaderDuringChain() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/jobs");
        request.addHeader("X-Request-ID", " req-42 ");
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, capturing(seen));

        assertThat(seen)
                .containsEntry("requestId", "req-42")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/jobs");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-42");
    }

    @Test
    void generatesUuidWhenHeaderIsBlank() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/jobs/active");
        request.addHeader("X-Request-ID", "   ");
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, capturing(seen));

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get("requestId"));
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        filter.doFilter(new MockHttpServletRequest("GET", "/ping"), response, (req, res) -> { });

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() {
        FilterChain failing = (req, res) -> {
            throw new ServletException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(new MockHttpServletRequest("POST", "/api/jobs/cancel"),
                response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    private static FilterChain capturing(Map<String, String> seen) {
        return (req, res) -> seen.putAll(ThreadContext.getImmutableContext());
    }
}
