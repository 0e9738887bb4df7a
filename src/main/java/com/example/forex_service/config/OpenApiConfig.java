package com.example.forex_service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API metadata. The advertised server is the address the service binds to.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI forexServiceOpenAPI(@Value("${server.address:127.0.0.1}") String address,
                                       @Value("${server.port:8080}") int port,
                                       @Value("${forex.storage.file:database.json}") String storageFile) {
        Server local = new Server()
                .url("http://" + address + ":" + port)
                .description("Local instance");

        return new OpenAPI()
                .info(new Info()
                        .title("Forex Pair Service API")
                        .description("Create, read, update and delete forex pair quotes. Ids are unsigned 64-bit numbers. "
                                + "Every change rewrites " + storageFile + ".")
                        .version("1.0"))
                .addServersItem(local);
    }
}
