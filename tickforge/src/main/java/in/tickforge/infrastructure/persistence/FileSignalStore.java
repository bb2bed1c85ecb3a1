package in.tickforge.infrastructure.persistence;

import in.tickforge.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * File-system signal store: {@code <baseDir>/<entity>/<key>.json}.
 *
 * Writes go through {@link AtomicFileWriter}; the rename is the commit point.
 */
public final class FileSignalStore implements SignalStore {
    private static final Logger log = LoggerFactory.getLogger(FileSignalStore.class);
    private static final String SUFFIX = ".json";

    private final Path baseDir;

    public FileSignalStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(baseDir);
            int removed = 0;
            try (DirectoryStream<Path> entities = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
                for (Path entityDir : entities) {
                    try (DirectoryStream<Path> files = Files.newDirectoryStream(entityDir)) {
                        for (Path file : files) {
                            if (AtomicFileWriter.isTempFile(file) && Files.deleteIfExists(file)) {
                                removed++;
                            }
                        }
                    }
                }
            }
            log.info("File signal store ready at {} ({} stale temp files removed)", baseDir, removed);
        } catch (IOException e) {
            throw new PersistenceException("*", baseDir.toString(), "Failed to initialize file store", e);
        }
    }

    @Override
    public void write(String entityName, String storageKey, String payload) {
        Path target = path(entityName, storageKey);
        try {
            AtomicFileWriter.write(target, payload.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PersistenceException(entityName, storageKey, "Failed to write signal state", e);
        }
    }

    @Override
    public String read(String entityName, String storageKey) {
        Path file = path(entityName, storageKey);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new PersistenceException(entityName, storageKey, "Failed to read signal state", e);
        }
    }

    @Override
    public void delete(String entityName, String storageKey) {
        try {
            Files.deleteIfExists(path(entityName, storageKey));
        } catch (IOException e) {
            throw new PersistenceException(entityName, storageKey, "Failed to delete signal state", e);
        }
    }

    @Override
    public List<String> keys(String entityName) {
        Path dir = baseDir.resolve(entityName);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                if (!AtomicFileWriter.isTempFile(file)) {
                    String name = file.getFileName().toString();
                    keys.add(name.substring(0, name.length() - SUFFIX.length()));
                }
            }
        } catch (IOException e) {
            throw new PersistenceException(entityName, "*", "Failed to list signal state", e);
        }
        Collections.sort(keys);
        return keys;
    }

    Path path(String entityName, String storageKey) {
        return baseDir.resolve(entityName).resolve(storageKey + SUFFIX);
    }
}
