package com.whodunit.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.whodunit.contract.GameConfiguration;

/**
 * Body of {@code POST /v1/games}. Both fields are optional.
 */
public record GameRequest(
    @JsonProperty("seed") Long seed,
    @JsonProperty("configuration") GameConfiguration configuration
) {
}
