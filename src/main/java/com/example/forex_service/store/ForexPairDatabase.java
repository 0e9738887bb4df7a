package com.example.forex_service.store;

import com.example.forex_service.model.ForexPair;
import com.example.forex_service.model.UnsignedIdJson;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory collection of forex pairs keyed by id.
 * <p>
 * Not thread-safe: callers must hold the service lock. The Jackson shape is the
 * persisted file layout, {@code {"forex_pairs": {"<id>": {...}}}}.
 */
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class ForexPairDatabase {

    @JsonProperty("forex_pairs")
    @JsonSerialize(keyUsing = UnsignedIdJson.KeySerializer.class)
    private final Map<Long, ForexPair> forexPairs;

    public ForexPairDatabase() {
        this.forexPairs = new HashMap<>();
    }

    @JsonCreator
    ForexPairDatabase(@JsonProperty(value = "forex_pairs", required = true)
                      @JsonDeserialize(keyUsing = UnsignedIdJson.KeyParser.class) Map<Long, ForexPair> forexPairs) {
        Objects.requireNonNull(forexPairs, "forex_pairs must not be null");
        this.forexPairs = new HashMap<>(forexPairs);
    }

    /**
     * Inserts or replaces the pair stored under {@code forexPair.id()}.
     *
     * @return the replaced pair, or empty if the id was not present
     */
    public Optional<ForexPair> insert(ForexPair forexPair) {
        return Optional.ofNullable(forexPairs.put(forexPair.id(), forexPair));
    }

    public Optional<ForexPair> get(long id) {
        return Optional.ofNullable(forexPairs.get(id));
    }

    /**
     * Returns a copy of all pairs. Order is whatever the map iterates in.
     */
    public List<ForexPair> getAll() {
        return new ArrayList<>(forexPairs.values());
    }

    public void delete(long id) {
        forexPairs.remove(id);
    }

    // Same as insert: an unknown id is created rather than rejected.
    public void update(ForexPair forexPair) {
        forexPairs.put(forexPair.id(), forexPair);
    }

    /**
     * Replaces the whole content with the content of {@code other}.
     */
    public void replaceWith(ForexPairDatabase other) {
        forexPairs.clear();
        forexPairs.putAll(other.forexPairs);
    }

    public int size() {
        return forexPairs.size();
    }

    public boolean isEmpty() {
        return forexPairs.isEmpty();
    }
}
