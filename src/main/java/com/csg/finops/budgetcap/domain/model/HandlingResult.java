package com.csg.finops.budgetcap.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record HandlingResult(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("collectionName") String collectionName,
        @JsonProperty("costsPerIntervalStart") Map<String, Double> costsPerIntervalStart,
        @JsonProperty("total") double total,
        @JsonProperty("budgetAmount") double budgetAmount,
        @JsonProperty("action") BudgetAction action
) {
    public enum BudgetAction {
        NONE,
        BILLING_DISABLED
    }

    public static HandlingResult noAction(String projectId, String collectionName, CostLedger ledger, double budgetAmount) {
        return new HandlingResult(projectId, collectionName, ledger.asMap(), ledger.total(), budgetAmount, BudgetAction.NONE);
    }

    public static HandlingResult billingDisabled(String projectId, String collectionName, CostLedger ledger, double budgetAmount) {
        return new HandlingResult(projectId, collectionName, ledger.asMap(), ledger.total(), budgetAmount, BudgetAction.BILLING_DISABLED);
    }

    public boolean isBillingDisabled() {
        return action == BudgetAction.BILLING_DISABLED;
    }
}
