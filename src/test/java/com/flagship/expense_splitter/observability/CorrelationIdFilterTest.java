package com.flagship.expense_splitter.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("Incoming ID is visible in the MDC during the request and cleared afterwards")
    void testIncomingId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/groups");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
                MDC.put(CorrelationContext.GROUP_NAME_MDC_KEY, "trip");
            }
        });

        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.GROUP_NAME_MDC_KEY));
    }

    @Test
    @DisplayName("Missing ID is generated")
    void testGeneratedId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/groups"), response, new MockFilterChain());

        String id = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(id);
        assertEquals(8, id.length());
    }

    @Test
    @DisplayName("Actuator requests are not tagged")
    void testActuatorSkipped() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/actuator/health"), response, new MockFilterChain());

        assertNull(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
