package com.rpgtools.prereq.checker.batch;

import com.rpgtools.prereq.checker.FactProviderException;
import com.rpgtools.prereq.requirement.InvalidRequirementException;

/** Why one batch entry produced no result. */
public final class BatchError {
    private final int position;       // index of the entry in input order
    private final String errorType;   // simple class name of the cause
    private final String message;
    private final RuntimeException cause;

    public BatchError(int position, RuntimeException cause) {
        this.position = position;
        this.cause = cause;
        this.errorType = cause.getClass().getSimpleName();
        this.message = cause.getMessage();
    }

    public int position() { return position; }
    public String errorType() { return errorType; }
    public String message() { return message; }
    public RuntimeException cause() { return cause; }

    /** The requirement itself was malformed, as opposed to the facts being unavailable. */
    public boolean isInvalidRequirement() {
        return cause instanceof InvalidRequirementException;
    }

    public boolean isFactProviderFailure() {
        return cause instanceof FactProviderException;
    }

    @Override
    public String toString() {
        return "position=" + position + ", type=" + errorType + ", error=" + message;
    }
}
