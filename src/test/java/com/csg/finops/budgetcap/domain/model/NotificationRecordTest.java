package com.csg.finops.budgetcap.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationRecordTest {

    @Test
    void testRecordCopiesRawFieldsAndStampsAddedAt() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("budgetDisplayName", "p1");
        raw.put("budgetAmount", 100);
        raw.put("costAmount", 40.5);
        raw.put("costIntervalStart", "2024-01-01T08:00:00Z");
        raw.put("budgetAmountType", "SPECIFIED_AMOUNT");
        BudgetNotification notification = new BudgetNotification("p1", 100, 40.5,
                "2024-01-01T08:00:00Z", null, null, "SPECIFIED_AMOUNT", null, raw);

        NotificationRecord record = NotificationRecord.of(notification, LocalDateTime.of(2024, 1, 15, 9, 30, 0));
        Map<String, Object> document = record.toDocument();

        assertEquals("2024-01-15T09:30:00", record.addedAt());
        assertEquals("2024-01-15T09:30:00", document.get("addedAt"));
        assertEquals("p1", document.get("budgetDisplayName"));
        assertEquals(40.5, document.get("costAmount"));
        assertEquals("SPECIFIED_AMOUNT", document.get("budgetAmountType"));
        assertEquals(6, document.size());
    }

    @Test
    void testRecordIsIsolatedFromLaterChangesToSource() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("budgetDisplayName", "p1");
        NotificationRecord record = new NotificationRecord(raw, "2024-01-15T09:30:00");

        raw.put("costAmount", 99.0);

        assertFalse(record.fields().containsKey("costAmount"));
        assertThrows(UnsupportedOperationException.class, () -> record.fields().put("x", 1));
    }
}
