package com.whodunit.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Human-readable view of a game record.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameTranscript(
    @JsonProperty("seed") long seed,
    @JsonProperty("killer") String killer,
    @JsonProperty("scenario") List<String> scenario,
    @JsonProperty("propositions") List<String> propositions
) {
}
