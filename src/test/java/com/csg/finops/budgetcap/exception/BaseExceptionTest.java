package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BaseExceptionTest {

    @Test
    void testConstructor() {
        String message = "Test error message";
        String description = "CONTROLLER";
        Response.Status httpStatus = Response.Status.BAD_REQUEST;
        String responseCode = "E1000";
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();

        BaseException exception = new BaseException(
                message, description, httpStatus, responseCode, stackTrace
        );

        assertEquals(message, exception.getMessage());
        assertEquals(description, exception.getDescription());
        assertEquals(httpStatus, exception.getHttpStatus());
        assertEquals(responseCode, exception.getResponseCode());
        assertEquals(stackTrace, exception.getStackTraceElements());
    }

    @Test
    void testToString() {
        BaseException exception = new BaseException(
                "Test error", "CONTROLLER", Response.Status.BAD_REQUEST, "E1000", new StackTraceElement[0]
        );

        String result = exception.toString();

        assertTrue(result.contains("BaseException"));
        assertTrue(result.contains("Test error"));
        assertTrue(result.contains("CONTROLLER"));
        assertTrue(result.contains("E1000"));
    }

    @Test
    void testIsRuntimeException() {
        BaseException exception = new BaseException(
                "Error", "TEST", Response.Status.INTERNAL_SERVER_ERROR, "E1000", new StackTraceElement[0]
        );

        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    void testMalformedNotificationException() {
        IllegalArgumentException cause = new IllegalArgumentException("bad base64");

        MalformedNotificationException exception = new MalformedNotificationException("Malformed", cause);

        assertEquals(Response.Status.BAD_REQUEST, exception.getHttpStatus());
        assertEquals(ResponseCodeEnum.MALFORMED_NOTIFICATION.code(), exception.getResponseCode());
        assertSame(cause, exception.getCause());
        assertEquals(cause.getStackTrace().length, exception.getStackTraceElements().length);
    }

    @Test
    void testMalformedNotificationExceptionWithoutCause() {
        MalformedNotificationException exception = new MalformedNotificationException("Malformed");

        assertNull(exception.getCause());
        assertEquals(0, exception.getStackTraceElements().length);
    }

    @Test
    void testBillingAlreadyDisabledException() {
        BillingAlreadyDisabledException exception = new BillingAlreadyDisabledException("p2");

        assertEquals("p2", exception.getProjectId());
        assertEquals(Response.Status.CONFLICT, exception.getHttpStatus());
        assertEquals(ResponseCodeEnum.BILLING_ALREADY_DISABLED.code(), exception.getResponseCode());
        assertTrue(exception.getMessage().contains("p2"));
    }

    @Test
    void testCostLedgerStoreException() {
        RuntimeException cause = new RuntimeException("UNAVAILABLE");

        CostLedgerStoreException exception = new CostLedgerStoreException("Store down", cause);

        assertEquals(Response.Status.SERVICE_UNAVAILABLE, exception.getHttpStatus());
        assertEquals(ResponseCodeEnum.COST_LEDGER_STORE_ERROR.code(), exception.getResponseCode());
        assertSame(cause, exception.getCause());
    }

    @Test
    void testBillingControlException() {
        BillingControlException exception = new BillingControlException("Still linked");

        assertEquals(Response.Status.BAD_GATEWAY, exception.getHttpStatus());
        assertEquals(ResponseCodeEnum.BILLING_CONTROL_ERROR.code(), exception.getResponseCode());
        assertNull(exception.getCause());
    }
}
