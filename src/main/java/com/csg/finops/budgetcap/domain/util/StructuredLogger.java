package com.csg.finops.budgetcap.domain.util;

import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logger emitting {@code message key=value ...} lines, parseable by log aggregators.
 * Correlation data (Pub/Sub message id, billing account, budget, project) is carried in the MDC
 * and rendered by the console format configured in application.properties.
 */
public class StructuredLogger {

    public static final String MESSAGE_ID = "messageId";
    public static final String BILLING_ACCOUNT_ID = "billingAccountId";
    public static final String BUDGET_ID = "budgetId";
    public static final String PROJECT_ID = "projectId";
    public static final String OPERATION = "operation";

    private final Logger logger;

    private StructuredLogger(Logger logger) {
        this.logger = logger;
    }

    public static StructuredLogger getLogger(Class<?> clazz) {
        return new StructuredLogger(Logger.getLogger(clazz));
    }

    /**
     * Set correlation context for the Pub/Sub delivery being handled.
     */
    public static void setContext(String messageId, String billingAccountId, String budgetId) {
        if (messageId != null) MDC.put(MESSAGE_ID, messageId);
        if (billingAccountId != null) MDC.put(BILLING_ACCOUNT_ID, billingAccountId);
        if (budgetId != null) MDC.put(BUDGET_ID, budgetId);
    }

    public static void setProjectId(String projectId) {
        if (projectId != null) MDC.put(PROJECT_ID, projectId);
    }

    public static void setOperation(String operation) {
        if (operation != null) MDC.put(OPERATION, operation);
    }

    /**
     * Clear all MDC context (important for worker thread reuse)
     */
    public static void clearContext() {
        MDC.clear();
    }

    /**
     * Snapshot of the current thread's MDC, to be restored on a callback thread.
     */
    public static Map<String, Object> captureContext() {
        return new LinkedHashMap<>(MDC.getMap());
    }

    /**
     * Run an action with the given MDC installed, then put back the thread's own MDC.
     */
    public static void runWithContext(Map<String, Object> context, Runnable action) {
        Map<String, Object> previous = new LinkedHashMap<>(MDC.getMap());
        MDC.clear();
        context.forEach(MDC::put);
        try {
            action.run();
        } finally {
            MDC.clear();
            previous.forEach(MDC::put);
        }
    }

    public void info(String message, Map<String, Object> fields) {
        if (logger.isInfoEnabled()) {
            logger.info(formatStructured(message, fields));
        }
    }

    public void warn(String message, Map<String, Object> fields) {
        if (logger.isEnabled(Logger.Level.WARN)) {
            logger.warn(formatStructured(message, fields));
        }
    }

    /**
     * Log structured error with additional fields
     */
    public void error(String message, Throwable throwable, Map<String, Object> fields) {
        logger.error(formatStructured(message, fields), throwable);
    }

    static String formatStructured(String message, Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message.length() + fields.size() * 24);
        sb.append(message);
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            sb.append(' ').append(entry.getKey()).append('=');
            Object value = entry.getValue();
            if (value instanceof String) {
                sb.append('"').append(value).append('"');
            } else {
                sb.append(value);
            }
        }
        return sb.toString();
    }

    /**
     * Builder for structured log fields. Insertion order is kept so lines read consistently.
     */
    public static class Fields {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Fields() {
        }

        public static Fields create() {
            return new Fields();
        }

        /**
         * Add a field if value is not null.
         */
        public Fields add(String key, Object value) {
            if (value != null) {
                fields.put(key, value);
            }
            return this;
        }

        public Fields addProjectId(String projectId) {
            return add(PROJECT_ID, projectId);
        }

        public Fields addDuration(long durationMs) {
            fields.put("duration_ms", durationMs);
            return this;
        }

        /**
         * Add status field (success/failed/rejected).
         */
        public Fields addStatus(String status) {
            fields.put("status", status);
            return this;
        }

        public Fields addErrorCode(String errorCode) {
            return add("error_code", errorCode);
        }

        public Fields addComponent(String component) {
            fields.put("component", component);
            return this;
        }

        public Map<String, Object> build() {
            return fields;
        }
    }
}
