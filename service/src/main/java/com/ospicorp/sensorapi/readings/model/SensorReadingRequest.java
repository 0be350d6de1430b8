package com.ospicorp.sensorapi.readings.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Body of create, by-id update and the value-matched delete. For the delete the three
 * required fields are an exact-match filter and {@code time} is ignored.
 */
public record SensorReadingRequest(
    @NotNull @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "2024-01-01")
    LocalDate date,
    @NotNull @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "21.5")
    Double temperature,
    @NotNull @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "40")
    Double humidity,
    @Schema(type = "string", description = "Time of day, defaults to the server time on create",
        example = "13:45:00")
    LocalTime time
) {}
