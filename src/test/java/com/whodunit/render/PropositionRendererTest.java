package com.whodunit.render;

import com.whodunit.GameFixtures;
import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.GameRecord;
import com.whodunit.contract.PersonActivity;
import com.whodunit.contract.PropositionData;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PropositionRendererTest {

    @Test
    void rendersEachShape() {
        assertEquals("Joe was with wood",
            PropositionRenderer.render(new PropositionData.Statement("Joe", AttributeCategory.MATERIAL, "wood")));
        assertEquals("(Joe with wood) OR (John with pizza)",
            PropositionRenderer.render(new PropositionData.Disjunction("Joe", "John",
                AttributeCategory.MATERIAL, AttributeCategory.FOOD, "wood", "pizza")));
        assertEquals("If John was with pizza, then John is not the killer",
            PropositionRenderer.render(new PropositionData.AlibiImplication("John", AttributeCategory.FOOD, "pizza")));
        assertEquals("(Will with steel) OR (Joe with fish and government)",
            PropositionRenderer.render(new PropositionData.CompoundDisjunction("Will", "Joe", "steel", "fish", "government")));
        assertEquals("Bob was with metal (alibi: not the killer)",
            PropositionRenderer.render(new PropositionData.DirectElimination("Bob", AttributeCategory.MATERIAL, "metal")));
    }

    @Test
    void transcriptLines_areNumberedAndMarkTheKiller() {
        Map<String, PersonActivity> truth = new LinkedHashMap<>();
        truth.put("Joe", new PersonActivity("Python", "China", "Google", "government", "pizza", "wood"));
        truth.put("John", new PersonActivity("Java", "India", "Amazon", "system", "fish", "steel"));
        GameRecord record = GameRecord.of(9L, "John", GameFixtures.defaultConfiguration(), truth, List.of(
            new PropositionData.Statement("Joe", AttributeCategory.PLACE, "China"),
            new PropositionData.DirectElimination("Joe", AttributeCategory.FOOD, "pizza")));

        assertEquals(List.of(
            "1. Joe was with China",
            "2. Joe was with pizza (alibi: not the killer)"), PropositionRenderer.renderPropositions(record));
        assertEquals(List.of(
            "[innocent] Joe: technology=Python, place=China, company=Google, institution=government, food=pizza, material=wood",
            "[killer] John: technology=Java, place=India, company=Amazon, institution=system, food=fish, material=steel"),
            PropositionRenderer.renderScenario(record));
    }
}
