package com.ospicorp.sensorapi.readings.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * Value-matched update. {@code date}, {@code temperature} and {@code humidity} select the rows;
 * {@code new_temperature} and {@code new_humidity} are written to them. An absent new value
 * writes the matched value back, so a body without either is a no-op on every matched row.
 */
public record SensorReadingUpdateRequest(
    @NotNull @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "2024-01-01")
    LocalDate date,
    @NotNull @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "21.5")
    Double temperature,
    @NotNull @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "40")
    Double humidity,
    @JsonProperty("new_temperature") @Schema(example = "22.0") Double newTemperature,
    @JsonProperty("new_humidity") @Schema(example = "38") Double newHumidity
) {

  public double targetTemperature() {
    return newTemperature != null ? newTemperature : temperature;
  }

  public double targetHumidity() {
    return newHumidity != null ? newHumidity : humidity;
  }
}
