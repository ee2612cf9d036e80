package com.whodunit.scenario;

import com.whodunit.GameFixtures;
import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.GameConfiguration;
import com.whodunit.contract.PersonActivity;
import com.whodunit.logic.Atom;
import com.whodunit.logic.AtomSpace;
import com.whodunit.logic.Formula;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioInitializerTest {

    private final ScenarioInitializer initializer = new ScenarioInitializer();
    private final GameConfiguration configuration = GameFixtures.defaultConfiguration();

    @Test
    void sameSeed_drawsSameScenario() {
        Scenario first = initializer.drawScenario(configuration, new Random(42));
        Scenario second = initializer.drawScenario(configuration, new Random(42));

        assertEquals(first, second);
    }

    @Test
    void everyPersonGetsOneConfiguredValuePerCategory() {
        for (long seed = 0; seed < 50; seed++) {
            Scenario scenario = initializer.drawScenario(configuration, new Random(seed));

            assertEquals(configuration.names(), List.copyOf(scenario.groundTruth().keySet()));
            assertTrue(configuration.names().contains(scenario.killer()));
            for (PersonActivity activity : scenario.groundTruth().values()) {
                for (AttributeCategory category : AttributeCategory.values()) {
                    assertTrue(configuration.valuesOf(category).contains(activity.valueOf(category)),
                        category + " value " + activity.valueOf(category));
                }
            }
        }
    }

    @Test
    void innocents_excludeOnlyTheKiller() {
        Scenario scenario = initializer.drawScenario(configuration, new Random(3));

        assertEquals(configuration.names().size() - 1, scenario.innocents().size());
        assertFalse(scenario.innocents().contains(scenario.killer()));
    }

    @Test
    void baseKnowledgeBase_encodesExactlyOneKiller() {
        AtomSpace atomSpace = AtomSpace.build(configuration);
        KnowledgeBase knowledgeBase = initializer.baseKnowledgeBase(atomSpace);
        int n = configuration.names().size();

        assertEquals(1 + n * (n - 1) / 2, knowledgeBase.size());

        List<Atom> killers = atomSpace.killerAtoms();
        for (int mask = 0; mask < (1 << n); mask++) {
            int bits = mask;
            boolean holds = knowledgeBase.formulas().stream()
                .allMatch(f -> f.evaluate(atom -> {
                    int index = killers.indexOf(atom);
                    return index >= 0 && (bits & (1 << index)) != 0;
                }));
            assertEquals(Integer.bitCount(mask) == 1, holds, "mask " + Integer.toBinaryString(mask));
        }
    }

    @Test
    void knowledgeBase_isAppendOnlyAndReadOnlyToCallers() {
        KnowledgeBase knowledgeBase = new KnowledgeBase();
        Atom atom = new Atom("a", 1);

        assertTrue(knowledgeBase.isEmpty());
        assertEquals(1, knowledgeBase.append(atom));
        assertEquals(2, knowledgeBase.append(Formula.not(atom)));

        List<Formula> extended = knowledgeBase.withCandidate(atom);
        assertEquals(3, extended.size());
        assertEquals(2, knowledgeBase.size());
        assertThrows(UnsupportedOperationException.class, () -> knowledgeBase.formulas().add(atom));
        assertThrows(IllegalArgumentException.class, () -> knowledgeBase.append(null));
    }
}
