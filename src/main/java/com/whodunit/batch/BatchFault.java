package com.whodunit.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One game of a batch that did not produce a record.
 *
 * @param kind an {@link com.whodunit.engine.FaultKind} name, or {@code UNEXPECTED}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchFault(
    @JsonProperty("seed") long seed,
    @JsonProperty("kind") String kind,
    @JsonProperty("message") String message
) {
}
