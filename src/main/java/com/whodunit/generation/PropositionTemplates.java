package com.whodunit.generation;

import java.util.List;

public final class PropositionTemplates {

    private PropositionTemplates() {
    }

    /**
     * The standard mix. Plain statements dominate so games converge quickly;
     * the disjunctive shapes keep a person's full signature from showing up
     * all at once.
     */
    public static List<PropositionTemplate> standard() {
        return List.of(
            new StatementTemplate(40),
            new DisjunctionTemplate(20),
            new AlibiImplicationTemplate(20),
            new CompoundDisjunctionTemplate(15),
            new DirectEliminationTemplate(5)
        );
    }
}
