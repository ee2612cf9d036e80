package com.whodunit.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Names and attribute values a game is drawn from. List order is significant:
 * it fixes atom allocation and the random draw sequence for a given seed.
 *
 * The record only snapshots its inputs; {@link GameConfigurationValidator}
 * decides whether they describe a playable game.
 */
public record GameConfiguration(
    @JsonProperty("names") List<String> names,
    @JsonProperty("technologies") List<String> technologies,
    @JsonProperty("places") List<String> places,
    @JsonProperty("companies") List<String> companies,
    @JsonProperty("institutions") List<String> institutions,
    @JsonProperty("foods") List<String> foods,
    @JsonProperty("materials") List<String> materials
) {

    public GameConfiguration {
        names = snapshot(names);
        technologies = snapshot(technologies);
        places = snapshot(places);
        companies = snapshot(companies);
        institutions = snapshot(institutions);
        foods = snapshot(foods);
        materials = snapshot(materials);
    }

    public List<String> valuesOf(AttributeCategory category) {
        return category.valuesIn(this);
    }

    private static List<String> snapshot(List<String> values) {
        if (values == null) {
            return List.of();
        }
        // nulls are kept so the validator can report them
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
