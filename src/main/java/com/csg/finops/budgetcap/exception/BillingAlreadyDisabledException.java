package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Exception thrown when billing is not confirmed enabled for the project a notification targets.
 * Raised before any ledger read or write takes place.
 */
public class BillingAlreadyDisabledException extends BaseException {

    private static final String DESCRIPTION = "Notification Handler Layer";

    private final String projectId;

    public BillingAlreadyDisabledException(String projectId) {
        super(
            "Billing already in disabled state for project " + projectId,
            DESCRIPTION,
            Response.Status.CONFLICT,
            ResponseCodeEnum.BILLING_ALREADY_DISABLED.code(),
            new StackTraceElement[0]
        );
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
