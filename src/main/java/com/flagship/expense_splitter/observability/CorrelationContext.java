package com.flagship.expense_splitter.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID of the request being served.
 *
 * The ID comes from the {@code X-Correlation-ID} header (or is generated), is echoed in the
 * response and appears in every log line through the MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GROUP_NAME_MDC_KEY = "groupName";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Must be called when request processing ends.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random ID, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
