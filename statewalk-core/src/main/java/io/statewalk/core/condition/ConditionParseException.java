package io.statewalk.core.condition;

import java.io.Serial;

/// Thrown when a condition expression cannot be parsed.
///
/// @see ConditionParser
public class ConditionParseException extends IllegalArgumentException {

    @Serial private static final long serialVersionUID = 2950317846112875310L;

    private final int position;

    /// Creates exception with message and the offending character offset.
    ///
    /// @param message description of the syntax error
    /// @param position zero-based offset into the expression
    public ConditionParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
