package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.constant.ResponseCodeEnum;
import com.csg.finops.budgetcap.domain.model.response.ApiResponse;
import com.csg.finops.budgetcap.domain.util.StructuredLogger;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.time.Instant;

/**
 * Maps failures outside the {@link BaseException} hierarchy to 500 with the service layer response code,
 * so Pub/Sub redelivers them. JAX-RS errors keep the response they already carry.
 */
@Provider
public class UnexpectedExceptionMapper implements ExceptionMapper<Throwable> {

    private static final StructuredLogger LOG = StructuredLogger.getLogger(UnexpectedExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof WebApplicationException) {
            return ((WebApplicationException) exception).getResponse();
        }

        LOG.error("Unexpected failure handling budget notification", exception, StructuredLogger.Fields.create()
                .addErrorCode(ResponseCodeEnum.EXCEPTION_SERVICE_LAYER.code())
                .add("httpStatus", Response.Status.INTERNAL_SERVER_ERROR.getStatusCode())
                .add("errorType", exception.getClass().getSimpleName())
                .build());

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(toApiResponse())
                .type(MediaType.APPLICATION_JSON)
                .build();
    }

    static ApiResponse<Void> toApiResponse() {
        ApiResponse<Void> body = new ApiResponse<>();
        body.setTimestamp(Instant.now());
        body.setMessage(ResponseCodeEnum.EXCEPTION_SERVICE_LAYER.description());
        body.setStatus(Response.Status.INTERNAL_SERVER_ERROR);
        body.setResponseCode(ResponseCodeEnum.EXCEPTION_SERVICE_LAYER.code());
        return body;
    }
}
