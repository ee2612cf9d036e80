package com.whodunit.engine;

import com.whodunit.GameFixtures;
import com.whodunit.logic.Atom;
import com.whodunit.logic.AtomSpace;
import com.whodunit.logic.Formula;
import com.whodunit.logic.Sat4jSatisfiabilityOracle;
import com.whodunit.logic.SatisfiabilityException;
import com.whodunit.logic.SatisfiabilityOracle;
import com.whodunit.scenario.KnowledgeBase;
import com.whodunit.scenario.Scenario;
import com.whodunit.scenario.ScenarioInitializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SuspectCounterTest {

    private final SuspectCounter counter = new SuspectCounter(new Sat4jSatisfiabilityOracle());
    private AtomSpace atomSpace;
    private KnowledgeBase knowledgeBase;

    @BeforeEach
    void setUp() {
        atomSpace = AtomSpace.build(GameFixtures.colorConfiguration());
        knowledgeBase = new ScenarioInitializer().baseKnowledgeBase(atomSpace);
    }

    private Atom attribute(String person, String value) {
        return atomSpace.attribute(person, value).orElseThrow();
    }

    @Test
    void baseKnowledge_leavesEveryoneSuspect() {
        assertEquals(List.of("A", "B", "C", "D"), counter.count(knowledgeBase, atomSpace).suspects());
    }

    @Test
    void emptyKnowledge_leavesEveryoneSuspect() {
        SuspectReport report = counter.count(List.of(), atomSpace);

        assertEquals(4, report.count());
        assertFalse(report.isConverged());
    }

    @Test
    void seededColorGame_statementAboutAnInnocent_keepsEveryoneSuspect() {
        Scenario scenario = new ScenarioInitializer().drawScenario(GameFixtures.colorConfiguration(), new Random(7));
        String person = scenario.isKiller("A") ? "B" : "A";
        String color = scenario.activityOf(person).material();
        assertEquals(4, counter.count(knowledgeBase, atomSpace).count());

        knowledgeBase.append(attribute(person, color));

        List<String> suspects = counter.count(knowledgeBase, atomSpace).suspects();
        assertEquals(List.of("A", "B", "C", "D"), suspects);
        assertTrue(suspects.contains(scenario.killer()));
        assertFalse(scenario.isKiller(person));
    }

    @Test
    void plainStatement_excludesNobody() {
        knowledgeBase.append(attribute("A", "red"));

        assertEquals(4, counter.count(knowledgeBase, atomSpace).count());
    }

    @Test
    void alibiWithKnownValue_excludesThatPerson() {
        knowledgeBase.append(Formula.implies(attribute("A", "red"), Formula.not(atomSpace.killer("A"))));
        assertEquals(4, counter.count(knowledgeBase, atomSpace).count(), "alibi alone clears nobody");

        knowledgeBase.append(attribute("A", "red"));
        assertEquals(List.of("B", "C", "D"), counter.count(knowledgeBase, atomSpace).suspects());
    }

    @Test
    void directEliminations_convergeOnTheLastPerson() {
        for (String person : List.of("A", "B", "D")) {
            Atom atom = attribute(person, "blue");
            knowledgeBase.append(Formula.and(atom, Formula.implies(atom, Formula.not(atomSpace.killer(person)))));
        }

        SuspectReport report = counter.count(knowledgeBase, atomSpace);
        assertTrue(report.isConverged());
        assertEquals(List.of("C"), report.suspects());
    }

    @Test
    void contradictoryKnowledge_leavesNobody() {
        Atom red = attribute("A", "red");
        knowledgeBase.append(red);
        knowledgeBase.append(Formula.not(red));

        assertEquals(0, counter.count(knowledgeBase, atomSpace).count());
    }

    @Test
    void solverFailure_surfacesAsEngineFault() {
        SatisfiabilityOracle failing = conjunction -> {
            throw new SatisfiabilityException("solver timed out");
        };
        SuspectCounter failingCounter = new SuspectCounter(failing);

        EngineFaultException ex = assertThrows(EngineFaultException.class,
            () -> failingCounter.count(knowledgeBase, atomSpace));
        assertEquals(FaultKind.SOLVER_FAILURE, ex.getKind());
    }
}
