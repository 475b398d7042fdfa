package io.statewalk.core.tool;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Agent-facing description of a callable tool.
///
/// Definitions are what an agent sees: a name, a description and the argument shape.
/// How a call is applied is decided by the dispatcher from the catalogue entry the
/// definition belongs to, never by the definition itself.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank, parameter names unique
/// - **Postcondition**: All fields immutable after construction
///
/// ### Usage
/// {@snippet :
/// ToolDefinition write = new ToolDefinition(
///     "write_settings",
///     "Write attributes of context 'settings'",
///     List.of(ToolParameter.required("data", ParameterType.OBJECT, "Attribute values to set")));
/// }
///
/// @param name unique tool name within a catalogue, not null
/// @param description human-readable description for the agent, not null
/// @param parameters accepted arguments, not null (may be empty)
/// @see ToolCatalogue for the per-decision tool set
public record ToolDefinition(String name, String description, List<ToolParameter> parameters) {

    /// Compact constructor with validation.
    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(description, "description must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        if (parameters.stream().map(ToolParameter::name).distinct().count() != parameters.size()) {
            throw new IllegalArgumentException("Duplicate parameter names in tool '" + name + "'");
        }
    }

    /// Returns the names of the arguments a call must supply.
    ///
    /// @return required parameter names in declaration order, never null
    public List<String> requiredParameterNames() {
        return parameters.stream().filter(ToolParameter::required).map(ToolParameter::name).toList();
    }

    /// JSON-schema style argument types.
    public enum ParameterType {
        STRING,
        NUMBER,
        BOOLEAN,
        OBJECT,
        ARRAY;

        /// Returns the lower-case schema name, e.g. `object`.
        ///
        /// @return schema type name
        public String schemaName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /// Resolves a schema type name, defaulting to {@link #STRING}.
        ///
        /// @param name schema type name, may be null
        /// @return the parameter type, never null
        public static ParameterType fromSchemaName(String name) {
            if (name != null) {
                for (ParameterType type : values()) {
                    if (type.schemaName().equalsIgnoreCase(name.trim())) {
                        return type;
                    }
                }
            }
            return STRING;
        }
    }

    /// One argument of a tool.
    ///
    /// @param name argument name, not null
    /// @param type argument type, not null
    /// @param description human-readable description, not null
    /// @param required whether a call must supply it
    public record ToolParameter(
            String name, ParameterType type, String description, boolean required) {

        public ToolParameter {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }

        public static ToolParameter required(String name, ParameterType type, String description) {
            return new ToolParameter(name, type, description, true);
        }

        public static ToolParameter optional(String name, ParameterType type, String description) {
            return new ToolParameter(name, type, description, false);
        }
    }
}
