package com.ospicorp.sensorapi.config;

import java.time.OffsetDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Probes the database once at startup. A failure is logged and the service keeps starting;
 * each request reports its own backend errors.
 */
@Component
@ConditionalOnProperty(name = "sensor.db.startup-check.enabled", havingValue = "true",
    matchIfMissing = true)
public class DatabaseConnectivityCheck implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DatabaseConnectivityCheck.class);

  private final JdbcTemplate jdbcTemplate;

  public DatabaseConnectivityCheck(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void run(String... args) {
    check();
  }

  boolean check() {
    try {
      OffsetDateTime now = jdbcTemplate.queryForObject("SELECT NOW()", OffsetDateTime.class);
      log.info("Database is running. Current timestamp: {}", now);
      return true;
    } catch (DataAccessException ex) {
      log.error("Database connection failed: {}", ex.getMessage(), ex);
      return false;
    }
  }
}
