package com.example.demo.ods.exception;

/**
 * A state that valid input can never produce, e.g. a remaining repetition
 * count below one while splitting a run. Signals a bug in the engine itself.
 */
public class InternalInvariantException extends OdsException {

    public static final String INVARIANT_BROKEN = "INVARIANT_BROKEN";

    public InternalInvariantException(String description) {
        super(INVARIANT_BROKEN, description);
    }
}
