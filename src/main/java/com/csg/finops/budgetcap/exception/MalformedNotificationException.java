package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Exception thrown when an inbound budget notification cannot be decoded
 * or lacks one of its required fields.
 */
public class MalformedNotificationException extends BaseException {

    private static final String DESCRIPTION = "Notification Decoding Layer";

    /**
     * Constructs a new MalformedNotificationException.
     *
     * @param message the error message
     * @param cause   the underlying decoding failure
     */
    public MalformedNotificationException(String message, Throwable cause) {
        super(
            message,
            DESCRIPTION,
            Response.Status.BAD_REQUEST,
            ResponseCodeEnum.MALFORMED_NOTIFICATION.code(),
            cause != null ? cause.getStackTrace() : new StackTraceElement[0]
        );
        if (cause != null) {
            initCause(cause);
        }
    }

    public MalformedNotificationException(String message) {
        this(message, null);
    }
}
