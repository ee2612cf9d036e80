package com.whodunit.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The finished puzzle handed to downstream consumers: configuration
 * snapshot, ground truth, killer and the accepted propositions in the order
 * they were accepted. Read-only once built.
 *
 * Formulas are not included; consumers work from the descriptions.
 */
@JsonPropertyOrder({"seed", "killer", "names", "technologies", "places", "companies",
    "institutions", "foods", "materials", "ground_truth", "propositions"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameRecord(
    @JsonProperty("seed") long seed,
    @JsonProperty("killer") String killer,
    @JsonProperty("names") List<String> names,
    @JsonProperty("technologies") List<String> technologies,
    @JsonProperty("places") List<String> places,
    @JsonProperty("companies") List<String> companies,
    @JsonProperty("institutions") List<String> institutions,
    @JsonProperty("foods") List<String> foods,
    @JsonProperty("materials") List<String> materials,
    @JsonProperty("ground_truth") Map<String, PersonActivity> groundTruth,
    @JsonProperty("propositions") List<PropositionData> propositions
) {

    public GameRecord {
        names = List.copyOf(names);
        technologies = List.copyOf(technologies);
        places = List.copyOf(places);
        companies = List.copyOf(companies);
        institutions = List.copyOf(institutions);
        foods = List.copyOf(foods);
        materials = List.copyOf(materials);
        groundTruth = Collections.unmodifiableMap(new LinkedHashMap<>(groundTruth));
        propositions = List.copyOf(propositions);
    }

    public static GameRecord of(long seed, String killer, GameConfiguration configuration,
                                Map<String, PersonActivity> groundTruth,
                                List<PropositionData> propositions) {
        return new GameRecord(seed, killer,
            configuration.names(),
            configuration.technologies(),
            configuration.places(),
            configuration.companies(),
            configuration.institutions(),
            configuration.foods(),
            configuration.materials(),
            groundTruth,
            propositions);
    }

    @JsonIgnore
    public GameConfiguration configuration() {
        return new GameConfiguration(names, technologies, places, companies, institutions, foods, materials);
    }
}
