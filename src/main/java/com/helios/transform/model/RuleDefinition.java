package com.helios.transform.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON representation of a rule record for deserialization.
 * This is a simple Data Transfer Object (DTO) used only for loading.
 * <p>
 * The action is kept as a raw object because its parameters depend on the operator;
 * the compiler turns it into typed {@link StepParameters}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("when") String when,
        @JsonProperty("condition") ConditionDefinition condition,
        @JsonProperty("action") ObjectNode action,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled
) {
    /**
     * DTO for the optional guard. {@code value} is absent for unary checks.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConditionDefinition(
            @JsonProperty("op") String op,
            @JsonProperty("value") JsonNode value
    ) {}

    public Boolean enabled() {
        return enabled != null ? enabled : true;
    }
}
