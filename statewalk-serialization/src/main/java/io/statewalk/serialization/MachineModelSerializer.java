package io.statewalk.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.statewalk.core.model.MachineModel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/// Loads and stores machine models as JSON.
///
/// This is the one concrete model producer shipped with statewalk: a front-end (DSL
/// parser, editor) emits the flattened node/edge document, and the engine consumes the
/// `MachineModel` read from it.
///
/// ### Usage
/// {@snippet :
/// MachineModel model = MachineModelSerializer.read(Path.of("review.json"));
/// ExecutionResult result = ExecutionEngine.builder(model).agent(agent).build().run();
///
/// String json = MachineModelSerializer.toJson(model);
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`; cache it
/// for high-throughput use.
///
/// @see StatewalkJacksonModule for the registered type handlers
public final class MachineModelSerializer {

    private static final Logger logger = Logger.getLogger(MachineModelSerializer.class.getName());

    private MachineModelSerializer() {}

    /// Serializes a model to pretty-printed JSON.
    ///
    /// @param model the model to serialize, not null
    /// @return JSON document, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(MachineModel model) {
        Objects.requireNonNull(model, "model must not be null");
        try {
            return createMapper().writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize machine model: " + e.getMessage(), e);
        }
    }

    /// Deserializes a model from JSON.
    ///
    /// @param json JSON document, not null
    /// @return the model, never null
    /// @throws IllegalArgumentException if the document is malformed or misses required fields
    /// @throws io.statewalk.core.exception.MachineStructureException if the model references
    ///     undeclared nodes, repeats a node name or has a parent cycle
    public static MachineModel fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        ObjectMapper mapper = createMapper();
        try {
            return MachineModelJsonDeserializer.fromTree(mapper, mapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize machine model: " + e.getMessage(), e);
        }
    }

    /// Reads a model from a UTF-8 JSON file.
    ///
    /// @param file file to read, not null
    /// @return the model, never null
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the document is malformed
    public static MachineModel read(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read machine model from " + file, e);
        }
        MachineModel model = fromJson(json);
        logger.info(
                "Loaded machine model '"
                        + model.title()
                        + "' from "
                        + file
                        + " ("
                        + model.nodes().size()
                        + " nodes, "
                        + model.edges().size()
                        + " edges)");
        return model;
    }

    /// Writes a model to a UTF-8 JSON file, replacing any existing content.
    ///
    /// @param model the model to write, not null
    /// @param file target file, not null
    /// @throws UncheckedIOException if the file cannot be written
    public static void write(MachineModel model, Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try {
            Files.writeString(file, toJson(model), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write machine model to " + file, e);
        }
    }

    /// Creates an ObjectMapper configured for statewalk types.
    ///
    /// Registers:
    /// - `StatewalkJacksonModule` for models, failures and result mixins
    /// - `JavaTimeModule` for `Instant` and `Duration` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps and durations written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StatewalkJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
