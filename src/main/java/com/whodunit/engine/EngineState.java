package com.whodunit.engine;

/**
 * Phases of one game in the convergence loop.
 */
public enum EngineState {
    INITIALIZING,
    GENERATING,
    ACCEPTING,
    REJECTING,
    CHECKING,
    CONVERGED,
    TERMINATED_MAX_ATTEMPTS
}
