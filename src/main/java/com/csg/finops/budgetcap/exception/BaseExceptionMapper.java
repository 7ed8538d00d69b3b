package com.csg.finops.budgetcap.exception;

import com.csg.finops.budgetcap.domain.model.response.ApiResponse;
import com.csg.finops.budgetcap.domain.util.StructuredLogger;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.time.Instant;

/**
 * Maps service exceptions to their HTTP status with an {@link ApiResponse} body carrying the response code.
 */
@Provider
public class BaseExceptionMapper implements ExceptionMapper<BaseException> {

    private static final StructuredLogger LOG = StructuredLogger.getLogger(BaseExceptionMapper.class);

    @Override
    public Response toResponse(BaseException exception) {
        LOG.error(exception.getMessage(), exception, StructuredLogger.Fields.create()
                .addErrorCode(exception.getResponseCode())
                .add("layer", exception.getDescription())
                .add("httpStatus", exception.getHttpStatus().getStatusCode())
                .add("errorType", exception.getClass().getSimpleName())
                .build());

        return Response.status(exception.getHttpStatus())
                .entity(toApiResponse(exception))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }

    static ApiResponse<Void> toApiResponse(BaseException exception) {
        ApiResponse<Void> body = new ApiResponse<>();
        body.setTimestamp(Instant.now());
        body.setMessage(exception.getMessage());
        body.setStatus(exception.getHttpStatus());
        body.setResponseCode(exception.getResponseCode());
        return body;
    }
}
