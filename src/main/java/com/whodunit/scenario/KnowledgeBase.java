package com.whodunit.scenario;

import com.whodunit.logic.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only conjunction of everything currently known to be true.
 *
 * Starts with the exactly-one-killer constraints. After that only the
 * convergence loop appends to it, and only propositions that passed the
 * feasibility check. Entries are never removed or replaced.
 */
public class KnowledgeBase {

    private final List<Formula> formulas = new ArrayList<>();
    private final List<Formula> view = Collections.unmodifiableList(formulas);

    /**
     * Appends a formula.
     *
     * @return the 1-based sequence number of the new entry
     */
    public int append(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("formula must not be null");
        }
        formulas.add(formula);
        return formulas.size();
    }

    /** Read-only live view in append order. */
    public List<Formula> formulas() {
        return view;
    }

    /** Snapshot of the current entries plus {@code candidate}; this knowledge base is untouched. */
    public List<Formula> withCandidate(Formula candidate) {
        List<Formula> extended = new ArrayList<>(formulas.size() + 1);
        extended.addAll(formulas);
        extended.add(candidate);
        return extended;
    }

    public int size() {
        return formulas.size();
    }

    public boolean isEmpty() {
        return formulas.isEmpty();
    }
}
