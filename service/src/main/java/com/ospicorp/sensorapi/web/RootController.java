package com.ospicorp.sensorapi.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Status")
public class RootController {
  static final String RUNNING = "Server is running!";

  @GetMapping("/")
  @Operation(summary = "Liveness message")
  public ResponseEntity<String> root() {
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .body(RUNNING);
  }
}
