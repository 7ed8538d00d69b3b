package com.csg.finops.budgetcap.domain.service;

import com.csg.finops.budgetcap.domain.constant.AppConstant;
import com.csg.finops.budgetcap.domain.model.BudgetNotification;
import com.csg.finops.budgetcap.exception.MalformedNotificationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Decodes the base64 {@code data} of a Pub/Sub message into a validated {@link BudgetNotification}.
 * Every rejection surfaces as {@link MalformedNotificationException}.
 */
@ApplicationScoped
public class BudgetNotificationDecoder {

    private static final TypeReference<Map<String, Object>> RAW_FIELDS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Inject
    public BudgetNotificationDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BudgetNotification decode(String base64Data) {
        if (base64Data == null || base64Data.isBlank()) {
            throw new MalformedNotificationException("Budget notification carries no data");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(base64Data.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedNotificationException("Budget notification data is not valid base64", e);
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(new String(decoded, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new MalformedNotificationException("Budget notification data is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedNotificationException("Budget notification data is not a JSON object");
        }

        return new BudgetNotification(
                requiredText(node, AppConstant.BUDGET_DISPLAY_NAME),
                requiredNumber(node, AppConstant.BUDGET_AMOUNT),
                requiredNumber(node, AppConstant.COST_AMOUNT),
                requiredText(node, AppConstant.COST_INTERVAL_START),
                optionalNumber(node, AppConstant.ALERT_THRESHOLD_EXCEEDED),
                optionalNumber(node, AppConstant.FORECAST_THRESHOLD_EXCEEDED),
                optionalText(node, AppConstant.BUDGET_AMOUNT_TYPE),
                optionalText(node, AppConstant.CURRENCY_CODE),
                objectMapper.convertValue(node, RAW_FIELDS_TYPE));
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new MalformedNotificationException("Budget notification field '" + field
                    + "' is missing or not a non-blank string");
        }
        return value.asText();
    }

    private static double requiredNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new MalformedNotificationException("Budget notification field '" + field
                    + "' is missing or not a number");
        }
        return value.asDouble();
    }

    private static Double optionalNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
