package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when a path repeats the same visit sequence without any change to the values
/// those visits depend on.
public class CycleDetectedException extends StateMachineException {

    @Serial private static final long serialVersionUID = 8812540076361197302L;

    public CycleDetectedException(String message) {
        super(FailureKind.CYCLE_DETECTED, message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(FailureKind.CYCLE_DETECTED, message, cause);
    }
}
