package com.phillippitts.docingest.config.logging;

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

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private MockHttpServletResponse response;
    private Map<String, String> seen;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        response = new MockHttpServletResponse();
        seen = new HashMap<>();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private FilterChain capturing() {
        return (req, res) -> seen.putAll(ThreadContext.getContext());
    }

    @Test
    void echoesRequestIdFromHeader() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/batches");
        request.addHeader("X-Request-ID", "batch-upload-1");

        filter.doFilter(request, response, capturing());

        assertThat(seen).containsEntry("requestId", "batch-upload-1");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("batch-upload-1");
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/documents");
        request.addHeader("X-Request-ID", "   ");

        filter.doFilter(request, response, capturing());

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get("requestId"));
    }

    @Test
    void setsUserIdOnlyWhenPresent() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/documents");
        request.addHeader("X-User-ID", "  ");

        filter.doFilter(request, response, capturing());

        assertThat(seen).doesNotContainKey("userId");
    }

    @Test
    void setsAllValuesInSingleRequest() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/documents/d1");
        request.addHeader("X-Request-ID", "req-xyz");
        request.addHeader("X-User-ID", "user-abc");

        filter.doFilter(request, response, capturing());

        assertThat(seen).containsEntry("requestId", "req-xyz")
                .containsEntry("userId", "user-abc")
                .containsEntry("method", "DELETE")
                .containsEntry("uri", "/api/documents/d1");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void restoresContextEvenWhenChainThrows() {
        ThreadContext.put("batchId", "outer");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/batches");
        FilterChain failing = (req, res) -> {
            throw new ServletException("Test exception");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
        assertThat(ThreadContext.get("batchId")).isEqualTo("outer");
    }

    @Test
    void preventsLeakageBetweenRequests() throws ServletException, IOException {
        MockHttpServletRequest first = new MockHttpServletRequest("GET", "/api/first");
        first.addHeader("X-User-ID", "user-1");
        filter.doFilter(first, new MockHttpServletResponse(), (req, res) -> { });

        MockHttpServletRequest second = new MockHttpServletRequest("POST", "/api/second");
        filter.doFilter(second, response, capturing());

        assertThat(seen).doesNotContainKey("userId").containsEntry("uri", "/api/second");
    }
}
