package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Exception thrown when a Cloud Billing call fails or when disabling billing
 * does not leave the project unlinked from its billing account.
 */
public class BillingControlException extends BaseException {

    private static final String DESCRIPTION = "Cloud Billing Client Layer";

    /**
     * Constructs a new BillingControlException.
     *
     * @param message the error message
     * @param cause   the underlying API failure
     */
    public BillingControlException(String message, Throwable cause) {
        super(
            message,
            DESCRIPTION,
            Response.Status.BAD_GATEWAY,
            ResponseCodeEnum.BILLING_CONTROL_ERROR.code(),
            cause != null ? cause.getStackTrace() : new StackTraceElement[0]
        );
        if (cause != null) {
            initCause(cause);
        }
    }

    public BillingControlException(String message) {
        this(message, null);
    }
}
