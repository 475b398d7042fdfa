package io.statewalk.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonProperty;

/// Jackson mixin that adds the path-prefixed `message` to serialized `ExecutionWarning`s.
///
/// The property is read-only: it is derived from `pathId` and the wrapped condition
/// warning, so it is ignored when a warning is read back.
///
/// @see io.statewalk.serialization.StatewalkJacksonModule
public abstract class ExecutionWarningMixin {

    @JsonProperty(value = "message", access = JsonProperty.Access.READ_ONLY)
    abstract String message();
}
