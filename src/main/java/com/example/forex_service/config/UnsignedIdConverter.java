package com.example.forex_service.config;

import com.example.forex_service.model.UnsignedIdJson;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Reads {@code long} path variables as unsigned 64-bit numbers, so
 * {@code /forex_pair/18446744073709551615} reaches the handler.
 * Anything else fails conversion and is answered with 404 by {@link GlobalErrorHandler}.
 */
@Component
public class UnsignedIdConverter implements Converter<String, Long> {

    @Override
    public Long convert(String source) {
        return UnsignedIdJson.parse(source.trim());
    }
}
