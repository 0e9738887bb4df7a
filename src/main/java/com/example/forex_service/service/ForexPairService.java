package com.example.forex_service.service;

import com.example.forex_service.model.ForexPair;

import java.util.List;
import java.util.Optional;

public interface ForexPairService {

    // Mutations, each one flushed to the database file before returning

    /**
     * Stores a new pair, replacing any pair with the same id.
     *
     * @throws ForexPairPersistenceException if the database file cannot be written
     */
    void createForexPair(ForexPair forexPair);

    /**
     * Replaces the pair with the same id. An unknown id is created.
     *
     * @throws ForexPairPersistenceException if the database file cannot be written
     */
    void updateForexPair(ForexPair forexPair);

    /**
     * Removes the pair if present. Unknown ids are ignored.
     *
     * @throws ForexPairPersistenceException if the database file cannot be written
     */
    void deleteForexPair(long id);

    // Reads

    Optional<ForexPair> getForexPair(long id);

    /**
     * Retrieves every stored pair, in no particular order.
     */
    List<ForexPair> getAllForexPairs();
}
