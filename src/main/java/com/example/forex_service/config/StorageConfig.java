package com.example.forex_service.config;

import com.example.forex_service.store.ForexPairDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    // The single database instance for the lifetime of the process.
    @Bean
    public ForexPairDatabase forexPairDatabase() {
        return new ForexPairDatabase();
    }
}
