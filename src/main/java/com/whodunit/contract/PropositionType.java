package com.whodunit.contract;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire names of the five proposition shapes, as written to {@code prop_type}.
 */
public enum PropositionType {
    STATEMENT("person_and_attribute"),
    DISJUNCTION("person_or_person"),
    ALIBI_IMPLICATION("person_attribute_implies_not_killer"),
    COMPOUND_DISJUNCTION("complex_or"),
    DIRECT_ELIMINATION("direct_elimination");

    private final String value;

    PropositionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
