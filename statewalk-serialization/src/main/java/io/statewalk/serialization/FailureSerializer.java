package io.statewalk.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.statewalk.core.exception.StateMachineException;
import java.io.IOException;
import java.io.Serial;

/// Writes a path failure as `{type, kind, category, message, cause?}`.
///
/// Stack traces are never written. `cause` holds the message of the underlying exception
/// when there is one.
///
/// @implNote Package-private. Registered by {@link StatewalkJacksonModule}. Failures are
/// written only; stored results are not read back into exceptions.
class FailureSerializer extends StdSerializer<StateMachineException> {

    @Serial private static final long serialVersionUID = 2291745023160098841L;

    FailureSerializer() {
        super(StateMachineException.class);
    }

    @Override
    public void serialize(
            StateMachineException failure, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", failure.getClass().getSimpleName());
        gen.writeStringField("kind", failure.getKind().name());
        gen.writeStringField("category", failure.getKind().category().name());
        gen.writeStringField("message", failure.getMessage());
        Throwable cause = failure.getCause();
        if (cause != null) {
            gen.writeStringField(
                    "cause",
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
        }
        gen.writeEndObject();
    }
}
