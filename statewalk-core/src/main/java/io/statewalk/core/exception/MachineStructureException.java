package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when a machine model is structurally unusable.
///
/// Raised at build time for edges or parents that reference undeclared nodes, and by the
/// engine before the first step when the model has no entry points. Aborts the whole run.
public class MachineStructureException extends StateMachineException {

    @Serial private static final long serialVersionUID = 7723014455092385161L;

    public MachineStructureException(String message) {
        super(FailureKind.STRUCTURE, message);
    }

    public MachineStructureException(String message, Throwable cause) {
        super(FailureKind.STRUCTURE, message, cause);
    }
}
