package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Exception thrown when the cost ledger or the notification records cannot be read or written.
 */
public class CostLedgerStoreException extends BaseException {

    private static final String DESCRIPTION = "Firestore Repository Layer";

    /**
     * Constructs a new CostLedgerStoreException.
     *
     * @param message the error message
     * @param cause   the underlying Firestore failure
     */
    public CostLedgerStoreException(String message, Throwable cause) {
        super(
            message,
            DESCRIPTION,
            Response.Status.SERVICE_UNAVAILABLE,
            ResponseCodeEnum.COST_LEDGER_STORE_ERROR.code(),
            cause != null ? cause.getStackTrace() : new StackTraceElement[0]
        );
        if (cause != null) {
            initCause(cause);
        }
    }

    public CostLedgerStoreException(String message) {
        this(message, null);
    }
}
