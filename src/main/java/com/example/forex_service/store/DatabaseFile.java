package com.example.forex_service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * The JSON file a {@link ForexPairDatabase} is flushed to and loaded from.
 * <p>
 * Every save rewrites the whole file. The content goes to a sibling {@code .tmp}
 * file first and is then moved over the target, so a crash mid-write leaves the
 * previous version in place.
 */
@Component
public class DatabaseFile {

    private static final Logger log = LoggerFactory.getLogger(DatabaseFile.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    @Autowired
    public DatabaseFile(@Value("${forex.storage.file:database.json}") String file, ObjectMapper objectMapper) {
        this(Path.of(file), objectMapper);
    }

    public DatabaseFile(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Serializes the entire database, overwriting the file.
     *
     * @throws IOException if the content cannot be serialized or written
     */
    public void save(ForexPairDatabase database) throws IOException {
        byte[] json = objectMapper.writeValueAsBytes(database);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.write(tmp, json);
            moveIntoPlace(tmp);
        } catch (IOException e) {
            // The previous file stays as it was; only the temp file is dropped.
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.debug("Saved {} forex pairs to {}", database.size(), path);
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Reads and parses the file.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws IOException if it cannot be read or does not hold a valid database
     */
    public ForexPairDatabase load() throws IOException {
        byte[] json = Files.readAllBytes(path);
        ForexPairDatabase database = objectMapper.readValue(json, ForexPairDatabase.class);
        if (database == null) {
            // A bare JSON null parses without error
            throw new IOException("Database file " + path + " does not hold a database");
        }
        return database;
    }
}
