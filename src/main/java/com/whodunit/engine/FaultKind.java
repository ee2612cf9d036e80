package com.whodunit.engine;

public enum FaultKind {
    /** An accepted proposition left nobody who can be the killer. */
    INCONSISTENT_KNOWLEDGE_BASE,
    /** The attempt bound ran out before a single suspect remained. */
    ATTEMPTS_EXHAUSTED,
    /** The SAT solver failed to decide a query. */
    SOLVER_FAILURE
}
