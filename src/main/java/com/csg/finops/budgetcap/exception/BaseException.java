package com.csg.finops.budgetcap.exception;

import jakarta.ws.rs.core.Response;

/**
 * Root of the service's exception hierarchy.
 * Carries the layer description, the HTTP status returned to the push subscription
 * and the response code reported in logs, metrics and the error body.
 */
public class BaseException extends RuntimeException {

    private final String description;
    private final Response.Status httpStatus;
    private final String responseCode;
    private final StackTraceElement[] stackTraceElements;

    public BaseException(String message,
                         String description,
                         Response.Status httpStatus,
                         String responseCode,
                         StackTraceElement[] stackTraceElements) {
        super(message);
        this.description = description;
        this.httpStatus = httpStatus;
        this.responseCode = responseCode;
        this.stackTraceElements = stackTraceElements;
    }

    public String getDescription() {
        return description;
    }

    public Response.Status getHttpStatus() {
        return httpStatus;
    }

    public String getResponseCode() {
        return responseCode;
    }

    public StackTraceElement[] getStackTraceElements() {
        return stackTraceElements;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{message='" + getMessage() + '\''
                + ", description='" + description + '\''
                + ", httpStatus=" + httpStatus
                + ", responseCode='" + responseCode + '\''
                + '}';
    }
}
