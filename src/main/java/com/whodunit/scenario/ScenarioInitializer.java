package com.whodunit.scenario;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.GameConfiguration;
import com.whodunit.contract.PersonActivity;
import com.whodunit.logic.Atom;
import com.whodunit.logic.AtomSpace;
import com.whodunit.logic.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Draws the hidden scenario of a game and seeds its knowledge base.
 *
 * Values are drawn independently per person, so two people may share a
 * value; that overlap is what keeps early clues ambiguous. The draw order
 * (people in configuration order, categories in declaration order, then the
 * killer) is fixed so a seed always reproduces the same scenario.
 */
@Component
public class ScenarioInitializer {

    private static final Logger log = LoggerFactory.getLogger(ScenarioInitializer.class);

    public Scenario drawScenario(GameConfiguration configuration, Random random) {
        Map<String, PersonActivity> groundTruth = new LinkedHashMap<>();
        for (String name : configuration.names()) {
            Map<AttributeCategory, String> values = new EnumMap<>(AttributeCategory.class);
            for (AttributeCategory category : AttributeCategory.values()) {
                values.put(category, pick(configuration.valuesOf(category), random));
            }
            groundTruth.put(name, PersonActivity.of(values));
        }

        String killer = pick(configuration.names(), random);
        log.debug("Scenario drawn: {} people, killer={}", groundTruth.size(), killer);
        return new Scenario(killer, groundTruth);
    }

    /**
     * A knowledge base holding only "exactly one person is the killer":
     * one clause over all killer atoms, then one "not both" clause per pair.
     */
    public KnowledgeBase baseKnowledgeBase(AtomSpace atomSpace) {
        List<Atom> killers = atomSpace.killerAtoms();
        KnowledgeBase knowledgeBase = new KnowledgeBase();
        knowledgeBase.append(Formula.or(killers));
        for (int i = 0; i < killers.size(); i++) {
            for (int j = i + 1; j < killers.size(); j++) {
                knowledgeBase.append(Formula.not(Formula.and(killers.get(i), killers.get(j))));
            }
        }
        return knowledgeBase;
    }

    private static <T> T pick(List<T> values, Random random) {
        return values.get(random.nextInt(values.size()));
    }
}
