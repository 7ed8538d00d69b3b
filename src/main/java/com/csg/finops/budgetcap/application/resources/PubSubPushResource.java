package com.csg.finops.budgetcap.application.resources;


import com.csg.finops.budgetcap.domain.constant.AppConstant;
import com.csg.finops.budgetcap.domain.model.HandlingResult;
import com.csg.finops.budgetcap.domain.model.pubsub.PubSubMessage;
import com.csg.finops.budgetcap.domain.model.pubsub.PubSubPushEnvelope;
import com.csg.finops.budgetcap.domain.model.response.ApiResponse;
import com.csg.finops.budgetcap.domain.service.BudgetNotificationHandler;
import com.csg.finops.budgetcap.domain.util.StructuredLogger;
import com.csg.finops.budgetcap.exception.MalformedNotificationException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.time.Instant;

/**
 * Push endpoint of the budget notifications Pub/Sub subscription.
 * A 2xx response acknowledges the message; any error status makes Pub/Sub redeliver it.
 */
@Path("/pubsub")
@ApplicationScoped
public class PubSubPushResource {
    private static final StructuredLogger LOG = StructuredLogger.getLogger(PubSubPushResource.class);
    private static final String COMPONENT = "pubsub-push";

    private final BudgetNotificationHandler budgetNotificationHandler;

    public PubSubPushResource(BudgetNotificationHandler budgetNotificationHandler) {
        this.budgetNotificationHandler = budgetNotificationHandler;
    }

    @POST
    @Path("/budget-notifications")
    @Produces(MediaType.APPLICATION_JSON)
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<ApiResponse<HandlingResult>> receive(PubSubPushEnvelope envelope) {
        long startTime = System.currentTimeMillis();
        PubSubMessage message = envelope == null ? null : envelope.message();
        if (message == null) {
            return Uni.createFrom().failure(new MalformedNotificationException("Push request carries no message"));
        }

        StructuredLogger.setContext(message.messageId(),
                message.attribute(AppConstant.ATTR_BILLING_ACCOUNT_ID),
                message.attribute(AppConstant.ATTR_BUDGET_ID));
        StructuredLogger.setOperation("PUBSUB_PUSH");
        LOG.info("Budget notification pushed", StructuredLogger.Fields.create()
                .add("messageId", message.messageId())
                .add("publishTime", message.publishTime())
                .add("subscription", envelope.subscription())
                .add("schemaVersion", message.attribute(AppConstant.ATTR_SCHEMA_VERSION))
                .addComponent(COMPONENT)
                .build());

        return budgetNotificationHandler.handle(message.data())
                .onItem().transform(PubSubPushResource::toResponse)
                .onItem().invoke(response -> LOG.info("Budget notification acknowledged", StructuredLogger.Fields.create()
                        .add("messageId", message.messageId())
                        .addDuration(System.currentTimeMillis() - startTime)
                        .addStatus("success")
                        .addComponent(COMPONENT)
                        .build()))
                .onFailure().invoke(failure -> LOG.warn("Budget notification rejected for redelivery", StructuredLogger.Fields.create()
                        .add("messageId", message.messageId())
                        .addDuration(System.currentTimeMillis() - startTime)
                        .addStatus("failed")
                        .add("errorType", failure.getClass().getSimpleName())
                        .addComponent(COMPONENT)
                        .build()))
                .eventually(StructuredLogger::clearContext);
    }

    private static ApiResponse<HandlingResult> toResponse(HandlingResult result) {
        ApiResponse<HandlingResult> response = new ApiResponse<>();
        response.setTimestamp(Instant.now());
        response.setStatus(Response.Status.OK);
        response.setMessage(result.isBillingDisabled()
                ? "Budget reached, billing disabled for project " + result.projectId()
                : "Budget not reached for project " + result.projectId());
        response.setData(result);
        return response;
    }
}
