package com.example.forex_service.service;

import com.example.forex_service.model.ForexPair;
import com.example.forex_service.model.UnsignedIdJson;
import com.example.forex_service.store.DatabaseFile;
import com.example.forex_service.store.ForexPairDatabase;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class InMemoryForexPairService implements ForexPairService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryForexPairService.class);

    // Guarded by lock, together with the database file.
    private final ForexPairDatabase database;
    private final DatabaseFile databaseFile;

    // One exclusive lock for reads and writes. It is held across the file write
    // so two saves never interleave.
    private final Lock lock = new ReentrantLock();

    public InMemoryForexPairService(ForexPairDatabase database, DatabaseFile databaseFile) {
        this.database = database;
        this.databaseFile = databaseFile;
    }

    /**
     * Fills the database from the file. A missing or unreadable file leaves it empty.
     */
    @PostConstruct
    public void loadDatabase() {
        lock.lock();
        try {
            if (!databaseFile.exists()) {
                log.info("No database file at {}, starting empty", databaseFile.getPath());
                return;
            }
            try {
                database.replaceWith(databaseFile.load());
                log.info("Loaded {} forex pairs from {}", database.size(), databaseFile.getPath());
            } catch (IOException e) {
                log.warn("Ignoring unreadable database file {}: {}", databaseFile.getPath(), e.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void createForexPair(ForexPair forexPair) {
        lock.lock();
        try {
            Optional<ForexPair> previous = database.insert(forexPair);
            log.info("Created forex pair {} ({}){}", UnsignedIdJson.format(forexPair.id()), forexPair.pair(),
                    previous.isPresent() ? ", replacing an existing one" : "");
            saveDatabase();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ForexPair> getForexPair(long id) {
        lock.lock();
        try {
            return database.get(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ForexPair> getAllForexPairs() {
        lock.lock();
        try {
            return database.getAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateForexPair(ForexPair forexPair) {
        lock.lock();
        try {
            database.update(forexPair);
            log.info("Updated forex pair {} ({})", UnsignedIdJson.format(forexPair.id()), forexPair.pair());
            saveDatabase();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteForexPair(long id) {
        lock.lock();
        try {
            database.delete(id);
            log.info("Deleted forex pair {}", UnsignedIdJson.format(id));
            saveDatabase();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock. No retry and no rollback of the in-memory change.
    private void saveDatabase() {
        try {
            databaseFile.save(database);
        } catch (IOException e) {
            throw new ForexPairPersistenceException(
                    "Could not write database file " + databaseFile.getPath(), e);
        }
    }
}
