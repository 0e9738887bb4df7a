package com.example.forex_service.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Jackson mapping for ids held in a {@code long} but read and written as
 * unsigned 64-bit numbers, so {@code 18446744073709551615} round-trips as-is.
 */
public final class UnsignedIdJson {

    static final BigInteger MAX_UNSIGNED = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private UnsignedIdJson() {
    }

    public static String format(long id) {
        return Long.toUnsignedString(id);
    }

    /**
     * @throws NumberFormatException if {@code text} is not a number in [0, 2^64)
     */
    public static long parse(String text) {
        return Long.parseUnsignedLong(text);
    }

    public static class Serializer extends StdSerializer<Long> {

        public Serializer() {
            super(Long.class);
        }

        @Override
        public void serialize(Long value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value >= 0) {
                gen.writeNumber(value);
            } else {
                gen.writeNumber(new BigInteger(format(value)));
            }
        }
    }

    public static class Deserializer extends StdDeserializer<Long> {

        public Deserializer() {
            super(Long.class);
        }

        @Override
        public Long deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_NUMBER_INT) {
                return (Long) ctxt.handleUnexpectedToken(Long.class, p);
            }
            BigInteger value = p.getBigIntegerValue();
            if (value.signum() < 0 || value.compareTo(MAX_UNSIGNED) > 0) {
                return (Long) ctxt.handleWeirdNumberValue(Long.class, value, "not an unsigned 64-bit id");
            }
            return value.longValue();
        }

        @Override
        public Long getNullValue(DeserializationContext ctxt) throws JsonMappingException {
            return (Long) ctxt.reportInputMismatch(this, "id must not be null");
        }
    }

    public static class KeySerializer extends StdSerializer<Long> {

        public KeySerializer() {
            super(Long.class);
        }

        @Override
        public void serialize(Long value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeFieldName(format(value));
        }
    }

    public static class KeyParser extends KeyDeserializer {

        @Override
        public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
            try {
                return parse(key);
            } catch (NumberFormatException e) {
                return ctxt.handleWeirdKey(Long.class, key, "not an unsigned 64-bit id");
            }
        }
    }
}
