package com.example.forex_service.controller;

import com.example.forex_service.model.ForexPair;
import com.example.forex_service.service.ForexPairService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@Tag(name = "Forex Pair API", description = "CRUD operations on forex pair quotes")
public class ForexPairController {

    private final ForexPairService forexPairService;

    public ForexPairController(ForexPairService forexPairService) {
        this.forexPairService = forexPairService;
    }

    @Operation(summary = "Create Forex Pair", description = "Stores a forex pair under the id it carries. An existing pair with that id is replaced.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pair stored", content = @Content),
            @ApiResponse(responseCode = "400", description = "Malformed body", content = @Content),
            @ApiResponse(responseCode = "500", description = "Database file could not be written")
    })
    @PostMapping("/forex_pair")
    public ResponseEntity<Void> createForexPair(@RequestBody ForexPair forexPair) {
        forexPairService.createForexPair(forexPair);
        return ResponseEntity.ok().build();
    }

    @Operation(summary = "Get All Forex Pairs", description = "Retrieves every stored forex pair, in no particular order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Successfully retrieved list",
                    content = { @Content(mediaType = "application/json", array = @ArraySchema(schema = @Schema(implementation = ForexPair.class))) })
    })
    @GetMapping("/forex_pairs")
    public ResponseEntity<List<ForexPair>> getAllForexPairs() {
        return ResponseEntity.ok(forexPairService.getAllForexPairs());
    }

    @Operation(summary = "Update Forex Pair", description = "Replaces the forex pair with the same id. An unknown id is created.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pair stored", content = @Content),
            @ApiResponse(responseCode = "400", description = "Malformed body", content = @Content),
            @ApiResponse(responseCode = "500", description = "Database file could not be written")
    })
    @PutMapping("/forex_pair")
    public ResponseEntity<Void> updateForexPair(@RequestBody ForexPair forexPair) {
        forexPairService.updateForexPair(forexPair);
        return ResponseEntity.ok().build();
    }

    @Operation(summary = "Get Forex Pair", description = "Retrieves the forex pair stored under the given id.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Forex pair found",
                    content = { @Content(mediaType = "application/json", schema = @Schema(implementation = ForexPair.class)) }),
            @ApiResponse(responseCode = "404", description = "No forex pair with this id", content = @Content)
    })
    @GetMapping("/forex_pair/{id}")
    public ResponseEntity<ForexPair> getForexPair(
            @Parameter(description = "Forex pair id, unsigned 64-bit", required = true)
            @PathVariable long id) {
        return forexPairService.getForexPair(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Delete Forex Pair", description = "Removes the forex pair with the given id. Unknown ids are ignored.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pair removed or was not present", content = @Content),
            @ApiResponse(responseCode = "500", description = "Database file could not be written")
    })
    @DeleteMapping("/forex_pair/{id}")
    public ResponseEntity<Void> deleteForexPair(
            @Parameter(description = "Forex pair id, unsigned 64-bit", required = true)
            @PathVariable long id) {
        forexPairService.deleteForexPair(id);
        return ResponseEntity.ok().build();
    }
}
