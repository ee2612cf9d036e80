package com.whodunit.engine;

import com.whodunit.logic.Atom;
import com.whodunit.logic.Formula;
import com.whodunit.logic.SatisfiabilityException;
import com.whodunit.logic.SatisfiabilityOracle;
import com.whodunit.scenario.KnowledgeBase;

import java.util.List;

/**
 * Decides whether a candidate may join the knowledge base: it may if the
 * real killer can still be the killer afterwards.
 *
 * Only reads the knowledge base. Appending an accepted candidate is the
 * controller's job.
 */
public class FeasibilityOracle {

    private final SatisfiabilityOracle oracle;

    public FeasibilityOracle(SatisfiabilityOracle oracle) {
        this.oracle = oracle;
    }

    public boolean isFeasible(KnowledgeBase knowledgeBase, Formula candidate, Atom killerAtom) {
        List<Formula> query = knowledgeBase.withCandidate(candidate);
        query.add(killerAtom);
        try {
            return oracle.isSatisfiable(query);
        } catch (SatisfiabilityException ex) {
            throw new EngineFaultException(FaultKind.SOLVER_FAILURE,
                "feasibility check failed for candidate " + candidate, ex);
        }
    }
}
