package io.statewalk.core.exception;

import java.io.Serial;

/// Thrown when an agent writes a context (or a field of one) the current node may not write.
public class PermissionDeniedException extends StateMachineException {

    @Serial private static final long serialVersionUID = 5566209357913712083L;

    public PermissionDeniedException(String message) {
        super(FailureKind.PERMISSION_DENIED, message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(FailureKind.PERMISSION_DENIED, message, cause);
    }
}
