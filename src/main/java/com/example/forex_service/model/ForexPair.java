package com.example.forex_service.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * A single currency-pair quote.
 * The id is supplied by the caller and acts as the unique key in the store.
 */
public record ForexPair(
        @JsonSerialize(using = UnsignedIdJson.Serializer.class)
        @JsonDeserialize(using = UnsignedIdJson.Deserializer.class)
        long id,        // unsigned 64-bit, values past Long.MAX_VALUE wrap negative
        String pair,    // e.g. "EUR/USD"
        double price
) {
    public ForexPair {
        Objects.requireNonNull(pair, "pair must not be null");
    }
}
