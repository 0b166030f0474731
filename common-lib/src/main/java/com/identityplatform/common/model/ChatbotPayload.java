package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record ChatbotPayload(
    @JsonProperty("answer")   String answer,
    @JsonProperty("provider") String provider
) implements ServicePayload {

    public ChatbotPayload {
        Objects.requireNonNull(answer, "answer");
    }
}
