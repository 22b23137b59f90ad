package com.wayfarer.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores one JSON document per run, named {@code <runId>.json}, under a directory.
 * Writes go to a temporary file first and are moved into place.
 */
public class FileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);
    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_RUN_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper mapper;

    public FileSnapshotStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(PlanningState state) {
        Path target = fileFor(state.runId());
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, state.runId(), ".tmp");
            mapper.writeValue(tmp.toFile(), state);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved snapshot of run {} at {} to {}", state.runId(), state.currentStage(), target);
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to save snapshot of run " + state.runId(), e);
        }
    }

    @Override
    public Optional<PlanningState> load(String runId) {
        Path file = fileFor(runId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), PlanningState.class));
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to read snapshot of run " + runId, e);
        }
    }

    @Override
    public List<String> listRunIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to list snapshots in " + directory, e);
        }
    }

    @Override
    public boolean delete(String runId) {
        try {
            return Files.deleteIfExists(fileFor(runId));
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to delete snapshot of run " + runId, e);
        }
    }

    private Path fileFor(String runId) {
        if (runId == null || !SAFE_RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return directory.resolve(runId + SUFFIX);
    }

    public Path getDirectory() {
        return directory;
    }
}
