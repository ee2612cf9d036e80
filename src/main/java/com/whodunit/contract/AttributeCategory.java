package com.whodunit.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * The six attribute categories every person carries in a scenario.
 * Declaration order is the order in which atoms are allocated and
 * ground-truth values are drawn.
 */
public enum AttributeCategory {
    TECHNOLOGY("technology"),
    PLACE("place"),
    COMPANY("company"),
    INSTITUTION("institution"),
    FOOD("food"),
    MATERIAL("material");

    private final String value;

    AttributeCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Values of this category in the given configuration. */
    public List<String> valuesIn(GameConfiguration configuration) {
        return switch (this) {
            case TECHNOLOGY -> configuration.technologies();
            case PLACE -> configuration.places();
            case COMPANY -> configuration.companies();
            case INSTITUTION -> configuration.institutions();
            case FOOD -> configuration.foods();
            case MATERIAL -> configuration.materials();
        };
    }

    @JsonCreator
    public static AttributeCategory fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown attribute category: " + raw));
    }
}
