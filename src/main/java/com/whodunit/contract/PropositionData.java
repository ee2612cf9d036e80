package com.whodunit.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Structured description of an accepted proposition. This is the only
 * persisted form of a proposition: the formula itself never leaves the engine.
 *
 * Each variant carries exactly the fields its shape needs; the shape is
 * written to {@code prop_type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "prop_type")
@JsonSubTypes({
    @JsonSubTypes.Type(PropositionData.Statement.class),
    @JsonSubTypes.Type(PropositionData.Disjunction.class),
    @JsonSubTypes.Type(PropositionData.AlibiImplication.class),
    @JsonSubTypes.Type(PropositionData.CompoundDisjunction.class),
    @JsonSubTypes.Type(PropositionData.DirectElimination.class)
})
public sealed interface PropositionData {

    @JsonIgnore
    PropositionType type();

    /** "{person} has {value}" for one of the person's attribute categories. */
    @JsonTypeName("person_and_attribute")
    @JsonPropertyOrder({"person", "attr_category", "value"})
    record Statement(
        @JsonProperty("person") String person,
        @JsonProperty("attr_category") AttributeCategory attrCategory,
        @JsonProperty("value") String value
    ) implements PropositionData {
        @Override
        public PropositionType type() {
            return PropositionType.STATEMENT;
        }
    }

    /** Either of two people has the given value. */
    @JsonTypeName("person_or_person")
    @JsonPropertyOrder({"person1", "person2", "attr1_cat", "attr2_cat", "val1", "val2"})
    record Disjunction(
        @JsonProperty("person1") String person1,
        @JsonProperty("person2") String person2,
        @JsonProperty("attr1_cat") AttributeCategory attr1Cat,
        @JsonProperty("attr2_cat") AttributeCategory attr2Cat,
        @JsonProperty("val1") String val1,
        @JsonProperty("val2") String val2
    ) implements PropositionData {
        @Override
        public PropositionType type() {
            return PropositionType.DISJUNCTION;
        }
    }

    /** If the person has the value, the person is not the killer. */
    @JsonTypeName("person_attribute_implies_not_killer")
    @JsonPropertyOrder({"person", "attr_category", "value"})
    record AlibiImplication(
        @JsonProperty("person") String person,
        @JsonProperty("attr_category") AttributeCategory attrCategory,
        @JsonProperty("value") String value
    ) implements PropositionData {
        @Override
        public PropositionType type() {
            return PropositionType.ALIBI_IMPLICATION;
        }
    }

    /** person1 has material mat1, or person2 has both food2 and inst2. */
    @JsonTypeName("complex_or")
    @JsonPropertyOrder({"person1", "person2", "mat1", "food2", "inst2"})
    record CompoundDisjunction(
        @JsonProperty("person1") String person1,
        @JsonProperty("person2") String person2,
        @JsonProperty("mat1") String mat1,
        @JsonProperty("food2") String food2,
        @JsonProperty("inst2") String inst2
    ) implements PropositionData {
        @Override
        public PropositionType type() {
            return PropositionType.COMPOUND_DISJUNCTION;
        }
    }

    /** The person has the value and is cleared by it. */
    @JsonTypeName("direct_elimination")
    @JsonPropertyOrder({"person", "attr_category", "value"})
    record DirectElimination(
        @JsonProperty("person") String person,
        @JsonProperty("attr_category") AttributeCategory attrCategory,
        @JsonProperty("value") String value
    ) implements PropositionData {
        @Override
        public PropositionType type() {
            return PropositionType.DIRECT_ELIMINATION;
        }
    }
}
