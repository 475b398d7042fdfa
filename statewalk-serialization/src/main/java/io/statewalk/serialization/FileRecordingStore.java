package io.statewalk.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.statewalk.core.recording.AgentInteraction;
import io.statewalk.core.recording.RecordingStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Recording store that keeps one JSON file per request in a directory.
///
/// Each interaction is written to `<url-encoded request id>.json`. Recording order is kept
/// in an `index` file holding one request id per line, so `listRequestIds()` does not
/// depend on directory listing order. Saving an id that is already recorded replaces its
/// file and keeps its place in the index.
///
/// ### Contracts
/// - **Precondition**: the directory is not shared with another writer
/// - **Postcondition**: every saved interaction is on disk when `save` returns
///
/// @implNote Thread-safe. All methods are `synchronized` on the store instance.
///
/// @see io.statewalk.core.recording.InMemoryRecordingStore
public class FileRecordingStore implements RecordingStore {

    private static final Logger logger = Logger.getLogger(FileRecordingStore.class.getName());

    static final String INDEX_FILE = "index";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    /// Opens a store in the given directory, creating it if needed.
    ///
    /// @param directory recording directory, not null
    /// @throws UncheckedIOException if the directory cannot be created
    public FileRecordingStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = MachineModelSerializer.createMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create recording directory " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized void save(AgentInteraction interaction) {
        Objects.requireNonNull(interaction, "interaction must not be null");
        String requestId = interaction.requestId();
        Path file = fileFor(requestId);
        boolean known = Files.exists(file);
        try {
            mapper.writeValue(file.toFile(), interaction);
            if (!known) {
                Files.writeString(
                        directory.resolve(INDEX_FILE),
                        requestId + System.lineSeparator(),
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save recording for " + requestId, e);
        }
        logger.fine("Saved recording " + requestId + " to " + file.getFileName());
    }

    @Override
    public synchronized Optional<AgentInteraction> find(String requestId) {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Path file = fileFor(requestId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), AgentInteraction.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read recording for " + requestId, e);
        }
    }

    @Override
    public synchronized List<String> listRequestIds() {
        Path index = directory.resolve(INDEX_FILE);
        if (!Files.exists(index)) {
            return List.of();
        }
        try {
            Set<String> ids = new LinkedHashSet<>();
            for (String line : Files.readAllLines(index, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    ids.add(line.trim());
                }
            }
            return new ArrayList<>(ids);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read recording index in " + directory, e);
        }
    }

    Path fileFor(String requestId) {
        return directory.resolve(URLEncoder.encode(requestId, StandardCharsets.UTF_8) + SUFFIX);
    }
}
