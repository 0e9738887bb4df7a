package com.example.forex_service;

import com.example.forex_service.model.ForexPair;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Runs the whole application against a database file in a temp directory.
 * Each test cleans up the ids it creates.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ForexServiceApplicationTests {

    @TempDir
    static Path storageDir;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("forex.storage.file", () -> storageDir.resolve("database.json").toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Create, read, update and delete a pair end to end")
    void crudScenario() throws Exception {
        mockMvc.perform(post("/forex_pair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ForexPair(1, "EUR/USD", 1.08))))
                .andExpect(status().isOk());

        mockMvc.perform(get("/forex_pairs"))
                .andExpect(status().isOk())
                .andExpect(content().json("[{\"id\":1,\"pair\":\"EUR/USD\",\"price\":1.08}]", true));

        mockMvc.perform(put("/forex_pair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ForexPair(1, "EUR/USD", 1.09))))
                .andExpect(status().isOk());

        mockMvc.perform(get("/forex_pair/{id}", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(1.09));

        JsonNode persisted = objectMapper.readTree(storageDir.resolve("database.json").toFile());
        assertThat(persisted.at("/forex_pairs/1/price").asDouble()).isEqualTo(1.09);

        mockMvc.perform(delete("/forex_pair/{id}", 1))
                .andExpect(status().isOk());

        mockMvc.perform(get("/forex_pair/{id}", 1))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/forex_pairs"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]", true));
    }

    @Test
    @DisplayName("Update of an unknown id creates the pair")
    void updateCreatesUnknownId() throws Exception {
        mockMvc.perform(put("/forex_pair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ForexPair(42, "AUD/NZD", 1.09))))
                .andExpect(status().isOk());

        mockMvc.perform(get("/forex_pair/{id}", 42))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(42))
                .andExpect(jsonPath("$.pair").value("AUD/NZD"))
                .andExpect(jsonPath("$.price").value(1.09));

        mockMvc.perform(delete("/forex_pair/{id}", 42))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("The largest unsigned 64-bit id works through body, path and file")
    void maxUnsignedId() throws Exception {
        mockMvc.perform(post("/forex_pair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":18446744073709551615,\"pair\":\"USD/SEK\",\"price\":10.4}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/forex_pair/{id}", "18446744073709551615"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("\"id\":18446744073709551615")))
                .andExpect(jsonPath("$.pair").value("USD/SEK"));

        JsonNode persisted = objectMapper.readTree(storageDir.resolve("database.json").toFile());
        assertThat(persisted.at("/forex_pairs/18446744073709551615/pair").asText()).isEqualTo("USD/SEK");

        mockMvc.perform(delete("/forex_pair/{id}", "18446744073709551615"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/forex_pair/{id}", "18446744073709551615"))
                .andExpect(status().isNotFound());
    }

    private String json(ForexPair pair) throws Exception {
        return objectMapper.writeValueAsString(pair);
    }
}
