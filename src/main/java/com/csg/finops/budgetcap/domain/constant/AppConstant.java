package com.csg.finops.budgetcap.domain.constant;

public class AppConstant {
    private AppConstant() {
    }

    // Budget notification fields
    public static final String BUDGET_DISPLAY_NAME = "budgetDisplayName";
    public static final String BUDGET_AMOUNT = "budgetAmount";
    public static final String COST_AMOUNT = "costAmount";
    public static final String COST_INTERVAL_START = "costIntervalStart";
    public static final String ALERT_THRESHOLD_EXCEEDED = "alertThresholdExceeded";
    public static final String FORECAST_THRESHOLD_EXCEEDED = "forecastThresholdExceeded";
    public static final String BUDGET_AMOUNT_TYPE = "budgetAmountType";
    public static final String CURRENCY_CODE = "currencyCode";
    public static final String ADDED_AT = "addedAt";

    // Pub/Sub message attributes set by Cloud Billing
    public static final String ATTR_BILLING_ACCOUNT_ID = "billingAccountId";
    public static final String ATTR_BUDGET_ID = "budgetId";
    public static final String ATTR_SCHEMA_VERSION = "schemaVersion";

    public static final String COLLECTION_NAME_SEPARATOR = "-";
    public static final String PROJECT_RESOURCE_PREFIX = "projects/";
    public static final String UNLINKED_BILLING_ACCOUNT = "";
}
