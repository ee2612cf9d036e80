package com.whodunit.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Picks a template by weighted draw and asks it for one candidate.
 *
 * Stateless apart from the template list: all game state, including the
 * random sequence, comes in through the {@link GenerationContext}.
 */
public class PropositionGenerator {

    private static final Logger log = LoggerFactory.getLogger(PropositionGenerator.class);

    private final List<PropositionTemplate> templates;
    private final int totalWeight;

    public PropositionGenerator(List<PropositionTemplate> templates) {
        if (templates.isEmpty()) {
            throw new IllegalArgumentException("at least one proposition template is required");
        }
        int total = 0;
        for (PropositionTemplate template : templates) {
            if (template.weight() <= 0) {
                throw new IllegalArgumentException("template " + template.type().getValue()
                    + " has non-positive weight " + template.weight());
            }
            total += template.weight();
        }
        this.templates = List.copyOf(templates);
        this.totalWeight = total;
    }

    /**
     * @return a candidate that is true in the scenario, or empty if the drawn
     *         template could not build one this time
     */
    public Optional<Proposition> generate(GenerationContext context) {
        PropositionTemplate template = draw(context.random().nextInt(totalWeight));
        Optional<Proposition> candidate = template.generate(context);
        if (candidate.isEmpty()) {
            log.debug("Template {} produced no candidate", template.type().getValue());
        }
        return candidate;
    }

    public List<PropositionTemplate> templates() {
        return templates;
    }

    private PropositionTemplate draw(int roll) {
        int cumulative = 0;
        for (PropositionTemplate template : templates) {
            cumulative += template.weight();
            if (roll < cumulative) {
                return template;
            }
        }
        // roll is always below totalWeight
        throw new IllegalStateException("weighted draw out of range: " + roll);
    }
}
