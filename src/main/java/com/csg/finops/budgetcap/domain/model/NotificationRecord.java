package com.csg.finops.budgetcap.domain.model;

import com.csg.finops.budgetcap.domain.constant.AppConstant;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit copy of a received budget notification, stamped with the time it was handled.
 * Written once per event under an auto-generated document id and never updated.
 */
public record NotificationRecord(Map<String, Object> fields, String addedAt) {

    public NotificationRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static NotificationRecord of(BudgetNotification notification, LocalDateTime addedAt) {
        return new NotificationRecord(notification.rawFields(),
                addedAt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>(fields);
        document.put(AppConstant.ADDED_AT, addedAt);
        return document;
    }
}
