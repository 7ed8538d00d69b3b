package com.csg.finops.budgetcap.domain.model.pubsub;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Message part of a Pub/Sub push request. {@code data} is the base64-encoded notification.
 */
public record PubSubMessage(
        @JsonProperty("data") String data,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("publishTime") String publishTime,
        @JsonProperty("attributes") Map<String, String> attributes
) {
    public String attribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }
}
