package com.ospicorp.sensorapi.readings.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDate;
import java.time.LocalTime;

// Row of sensor_readings; id and time are assigned by the database on insert
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SensorReading(
    @Schema(description = "Surrogate row identifier", example = "42") Long id,
    @Schema(description = "Reading date", example = "2024-01-01") LocalDate date,
    @JsonFormat(pattern = "HH:mm:ss")
    @Schema(type = "string", description = "Time of day", example = "13:45:00") LocalTime time,
    @Schema(description = "Temperature", example = "21.5") Double temperature,
    @Schema(description = "Relative humidity", example = "40") Double humidity
) {}
