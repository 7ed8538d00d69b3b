package com.csg.finops.budgetcap.domain.constant;
/**
 * Enum to define standard response codes and descriptions for the application.
 */
public enum ResponseCodeEnum {

    // General exception layer error
    EXCEPTION_SERVICE_LAYER("E1001", "Exception Service Layer Error"),

    // Budget notification processing
    MALFORMED_NOTIFICATION("E2001", "Malformed Budget Notification"),
    BILLING_ALREADY_DISABLED("E2002", "Billing Already Disabled"),
    COST_LEDGER_STORE_ERROR("E2003", "Cost Ledger Store Error"),
    BILLING_CONTROL_ERROR("E2004", "Billing Control Error");


    private final String code;
    private final String description;

    ResponseCodeEnum(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Returns the response code.
     */
    public String code() {
        return code;
    }

    /**
     * Returns the description of the response code.
     */
    public String description() {
        return description;
    }
}
