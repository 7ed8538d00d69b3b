package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import com.csg.finops.budgetcap.domain.model.response.ApiResponse;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BaseExceptionMapperTest {

    @Test
    void testBillingAlreadyDisabledBody() {
        ApiResponse<Void> body = BaseExceptionMapper.toApiResponse(new BillingAlreadyDisabledException("p2"));

        assertEquals(Response.Status.CONFLICT, body.getStatus());
        assertEquals(409, body.getStatus().getStatusCode());
        assertEquals(ResponseCodeEnum.BILLING_ALREADY_DISABLED.code(), body.getResponseCode());
        assertNotNull(body.getTimestamp());
        assertNull(body.getData());
    }

    @Test
    void testMalformedNotificationBody() {
        ApiResponse<Void> body = BaseExceptionMapper.toApiResponse(
                new MalformedNotificationException("missing costIntervalStart"));

        assertEquals(400, body.getStatus().getStatusCode());
        assertEquals("missing costIntervalStart", body.getMessage());
        assertEquals(ResponseCodeEnum.MALFORMED_NOTIFICATION.code(), body.getResponseCode());
    }

    @Test
    void testStoreAndBillingFailuresAreNotAcknowledged() {
        ApiResponse<Void> storeBody = BaseExceptionMapper.toApiResponse(new CostLedgerStoreException("down"));
        ApiResponse<Void> billingBody = BaseExceptionMapper.toApiResponse(new BillingControlException("still linked"));

        assertEquals(503, storeBody.getStatus().getStatusCode());
        assertEquals(502, billingBody.getStatus().getStatusCode());
    }
}
