package com.csg.finops.budgetcap.domain.model.pubsub;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a Pub/Sub push subscription request.
 */
public record PubSubPushEnvelope(
        @JsonProperty("message") PubSubMessage message,
        @JsonProperty("subscription") String subscription
) {
}
