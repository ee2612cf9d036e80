package com.whodunit.engine;

/**
 * The engine broke one of its own guarantees. Never thrown for ordinary
 * rejections; those are part of normal generation.
 */
public class EngineFaultException extends RuntimeException {

    private final FaultKind kind;

    public EngineFaultException(FaultKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EngineFaultException(FaultKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FaultKind getKind() {
        return kind;
    }
}
