package io.statewalk.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `PathResult`.
///
/// Hides the derived `completed` flag, which duplicates `status`, and omits the
/// `failure` and `parentPathId` fields when they are null.
///
/// @see io.statewalk.serialization.StatewalkJacksonModule
public abstract class PathResultMixin {

    @JsonIgnore
    abstract boolean isCompleted();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    abstract String parentPathId();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    abstract Object failure();
}
