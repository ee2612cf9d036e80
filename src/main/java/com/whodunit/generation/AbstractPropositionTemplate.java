package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;

import java.util.List;

abstract class AbstractPropositionTemplate implements PropositionTemplate {

    /** Categories alibis and disjunctions draw from. */
    static final List<AttributeCategory> CLUE_CATEGORIES = List.of(
        AttributeCategory.MATERIAL,
        AttributeCategory.INSTITUTION,
        AttributeCategory.FOOD);

    private final int weight;

    AbstractPropositionTemplate(int weight) {
        if (weight <= 0) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " weight must be positive: " + weight);
        }
        this.weight = weight;
    }

    @Override
    public int weight() {
        return weight;
    }
}
