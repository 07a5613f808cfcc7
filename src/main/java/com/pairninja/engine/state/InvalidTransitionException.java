package com.pairninja.engine.state;

/**
 * A state machine operation that would break a state invariant. The state is
 * left unchanged.
 */
public class InvalidTransitionException extends IllegalStateException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
