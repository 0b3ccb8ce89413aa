package com.poc.svc.ingestion.controller;

import com.poc.svc.ingestion.dto.ConsumerHealth;
import com.poc.svc.ingestion.service.consumer.ConsumerManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/ingestion/consumers")
public class ConsumerStatusController {

    private final ConsumerManager consumerManager;

    public ConsumerStatusController(ConsumerManager consumerManager) {
        this.consumerManager = consumerManager;
    }

    @GetMapping
    @Operation(
            operationId = "listConsumers",
            summary = "Per-queue consumer status",
            responses = @ApiResponse(
                    responseCode = "200",
                    description = "Consumer status per queue",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            array = @ArraySchema(schema = @Schema(implementation = ConsumerHealth.class))))
    )
    public List<ConsumerHealth> listConsumers() {
        return consumerManager.health();
    }
}
