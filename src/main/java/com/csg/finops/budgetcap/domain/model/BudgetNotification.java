package com.csg.finops.budgetcap.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated Cloud Billing budget notification.
 * The budget display name carries the id of the project to cap.
 * {@code rawFields} keeps every field of the decoded payload, known or not,
 * so the audit record is a full copy of what was received.
 */
public record BudgetNotification(
        String budgetDisplayName,
        double budgetAmount,
        double costAmount,
        String costIntervalStart,
        Double alertThresholdExceeded,
        Double forecastThresholdExceeded,
        String budgetAmountType,
        String currencyCode,
        Map<String, Object> rawFields
) {

    public BudgetNotification {
        rawFields = rawFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rawFields));
    }

    public String projectId() {
        return budgetDisplayName;
    }
}
