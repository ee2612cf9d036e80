package com.whodunit.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.whodunit.contract.GameConfiguration;

/**
 * Body of {@code POST /v1/games/batch}.
 */
public record BatchRequest(
    @JsonProperty("seed_start") long seedStart,
    @JsonProperty("count") int count,
    @JsonProperty("configuration") GameConfiguration configuration
) {
}
