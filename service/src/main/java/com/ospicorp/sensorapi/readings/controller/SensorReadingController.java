package com.ospicorp.sensorapi.readings.controller;

import com.ospicorp.sensorapi.readings.model.SensorReading;
import com.ospicorp.sensorapi.readings.model.SensorReadingRequest;
import com.ospicorp.sensorapi.readings.model.SensorReadingUpdateRequest;
import com.ospicorp.sensorapi.readings.service.SensorReadingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sensor-readings")
@Validated
@Tag(name = "Sensor readings")
public class SensorReadingController {
  static final String ROWS_AFFECTED_HEADER = "X-Rows-Affected";

  private static final String ADDED = "Sensor reading added successfully";
  private static final String UPDATED = "Sensor reading updated successfully";
  private static final String DELETED = "Sensor reading deleted successfully";

  private final SensorReadingService service;

  public SensorReadingController(SensorReadingService service) {
    this.service = service;
  }

  @GetMapping
  @Operation(summary = "Retrieve all sensor readings",
      description = "Fetch records from the sensor_readings table with pagination. Without a date, all dates are paged.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "A list of sensor readings.",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = SensorReading.class)))),
      @ApiResponse(responseCode = "400", description = "Malformed date, or limit or page out of range",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "500", description = "Backend failure",
          content = @Content(mediaType = "text/plain", schema = @Schema(type = "string")))
  })
  public List<SensorReading> list(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          @Parameter(description = "The date for which sensor readings are requested (format: YYYY-MM-DD)",
              example = "2017-12-22") LocalDate date,
      @RequestParam(required = false)
          @Parameter(description = "Page number for pagination (default is 1)",
              schema = @Schema(type = "integer", defaultValue = "1")) String page,
      @RequestParam(required = false)
          @Parameter(description = "Number of records per page (default is 100, at most 1000)",
              schema = @Schema(type = "integer", defaultValue = "100")) String limit) {
    return service.list(date, page, limit);
  }

  @GetMapping("/procedure")
  @Operation(summary = "Retrieve sensor readings by date using the stored procedure",
      description = "Get sensor readings for a specific date through get_sensor_readings_by_date.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "A list of sensor readings for the specified date.",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = SensorReading.class)))),
      @ApiResponse(responseCode = "400", description = "Missing or malformed date",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "500", description = "Backend failure",
          content = @Content(mediaType = "text/plain", schema = @Schema(type = "string")))
  })
  public List<SensorReading> listByDate(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          @Parameter(description = "The date for which sensor readings are requested (format: YYYY-MM-DD)",
              example = "2017-12-22") LocalDate date) {
    return service.listByDate(date);
  }

  @GetMapping("/{id}")
  @Operation(summary = "Retrieve one sensor reading by id")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "The sensor reading",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SensorReading.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SensorReading get(@PathVariable @Parameter(description = "Reading id", example = "42") long id) {
    return service.get(id);
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Add a new sensor reading", description = "Store a new sensor reading in the database.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Successfully created.",
          headers = @Header(name = "Location", description = "URI of the new reading", schema = @Schema(type = "string"))),
      @ApiResponse(responseCode = "400", description = "Missing or malformed field",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<String> create(@Valid @RequestBody SensorReadingRequest request) {
    long id = service.create(request);
    return ResponseEntity.created(URI.create("/sensor-readings/" + id))
        .contentType(MediaType.TEXT_PLAIN)
        .body(ADDED);
  }

  @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Update existing sensor readings by value",
      description = "Rows whose date, temperature and humidity equal the given values receive new_temperature and new_humidity. "
          + "Succeeds whether or not any row matched.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Successfully updated.",
          headers = @Header(name = ROWS_AFFECTED_HEADER, description = "Number of rows updated", schema = @Schema(type = "integer"))),
      @ApiResponse(responseCode = "400", description = "Missing or malformed field",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<String> updateMatching(@Valid @RequestBody SensorReadingUpdateRequest request) {
    int updated = service.updateMatching(request);
    return textResponse(HttpStatus.OK, UPDATED, updated);
  }

  @DeleteMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Delete sensor readings by value",
      description = "Remove every sensor reading matching date, temperature and humidity.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Successfully deleted.",
          headers = @Header(name = ROWS_AFFECTED_HEADER, description = "Number of rows deleted", schema = @Schema(type = "integer"))),
      @ApiResponse(responseCode = "400", description = "Missing or malformed field",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<String> deleteMatching(@Valid @RequestBody SensorReadingRequest request) {
    int deleted = service.deleteMatching(request);
    return textResponse(HttpStatus.OK, DELETED, deleted);
  }

  @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Replace one sensor reading by id")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Successfully updated.",
          headers = @Header(name = ROWS_AFFECTED_HEADER, description = "Always 1", schema = @Schema(type = "integer"))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<String> update(@PathVariable long id, @Valid @RequestBody SensorReadingRequest request) {
    service.update(id, request);
    return textResponse(HttpStatus.OK, UPDATED, 1);
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete one sensor reading by id")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Successfully deleted.",
          headers = @Header(name = ROWS_AFFECTED_HEADER, description = "Always 1", schema = @Schema(type = "integer"))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<String> delete(@PathVariable long id) {
    service.delete(id);
    return textResponse(HttpStatus.OK, DELETED, 1);
  }

  private static ResponseEntity<String> textResponse(HttpStatus status, String message, int rows) {
    return ResponseEntity.status(status)
        .header(ROWS_AFFECTED_HEADER, Integer.toString(rows))
        .contentType(MediaType.TEXT_PLAIN)
        .body(message);
  }
}
