package com.whodunit.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Ground-truth activity of one person: exactly one value per category.
 */
@JsonPropertyOrder({"technology", "place", "company", "institution", "food", "material"})
public record PersonActivity(
    @JsonProperty("technology") String technology,
    @JsonProperty("place") String place,
    @JsonProperty("company") String company,
    @JsonProperty("institution") String institution,
    @JsonProperty("food") String food,
    @JsonProperty("material") String material
) {

    public String valueOf(AttributeCategory category) {
        return switch (category) {
            case TECHNOLOGY -> technology;
            case PLACE -> place;
            case COMPANY -> company;
            case INSTITUTION -> institution;
            case FOOD -> food;
            case MATERIAL -> material;
        };
    }

    /**
     * Builds an activity from a complete category-to-value map.
     */
    public static PersonActivity of(Map<AttributeCategory, String> values) {
        for (AttributeCategory category : AttributeCategory.values()) {
            if (values.get(category) == null) {
                throw new IllegalArgumentException("missing value for " + category.getValue());
            }
        }
        return new PersonActivity(
            values.get(AttributeCategory.TECHNOLOGY),
            values.get(AttributeCategory.PLACE),
            values.get(AttributeCategory.COMPANY),
            values.get(AttributeCategory.INSTITUTION),
            values.get(AttributeCategory.FOOD),
            values.get(AttributeCategory.MATERIAL));
    }
}
