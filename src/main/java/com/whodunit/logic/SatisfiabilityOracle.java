package com.whodunit.logic;

import java.util.ArrayList;
import java.util.List;

/**
 * Propositional satisfiability check. Implementations must be stateless
 * between calls so one instance can serve many games at once.
 */
public interface SatisfiabilityOracle {

    /**
     * Whether the conjunction of all formulas has a model.
     * An empty conjunction is satisfiable.
     */
    boolean isSatisfiable(List<Formula> conjunction);

    /**
     * The probes that can be true together with the conjunction, in probe order.
     * Default implementation asks once per probe.
     */
    default List<Atom> satisfiableAtoms(List<Formula> conjunction, List<Atom> probes) {
        List<Atom> result = new ArrayList<>();
        for (Atom probe : probes) {
            List<Formula> withProbe = new ArrayList<>(conjunction);
            withProbe.add(probe);
            if (isSatisfiable(withProbe)) {
                result.add(probe);
            }
        }
        return result;
    }
}
