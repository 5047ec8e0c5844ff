package com.phillippitts.mcphub.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MdcFilterTest {

    private final MdcFilter filter = new MdcFilter();

    @Test
    void propagatesIncomingRequestIdAndClearsAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/tasks");
        request.addHeader("X-Request-ID", "abc-123");
        request.addHeader("X-User-ID", "user-9");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> seen.putAll(ThreadContext.getImmutableContext()));

        assertThat(seen)
                .containsEntry("requestId", "abc-123")
                .containsEntry("userId", "user-9")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/tasks");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("abc-123");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesRequestIdWhenAbsent() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/catalog");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> seen.putAll(ThreadContext.getImmutableContext()));

        assertThat(seen.get("requestId")).isNotBlank();
        assertThat(seen).doesNotContainKey("userId");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get("requestId"));
    }
}
