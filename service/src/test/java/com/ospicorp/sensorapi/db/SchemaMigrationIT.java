package com.ospicorp.sensorapi.db;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers
class SchemaMigrationIT {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @Test
  void flywayCreatesReadingsTable() {
    List<String> columns = jdbcTemplate.queryForList(
        """
        SELECT column_name FROM information_schema.columns
        WHERE table_schema = 'public' AND table_name = 'sensor_readings'
        ORDER BY ordinal_position
        """,
        String.class);

    assertThat(columns).containsExactly("id", "date", "time", "temperature", "humidity");
  }

  @Test
  void routineReturnsRowsForOneDateOrderedByTime() {
    jdbcTemplate.update("TRUNCATE sensor_readings RESTART IDENTITY");
    LocalDate day = LocalDate.of(2017, 12, 22);
    jdbcTemplate.update(
        "INSERT INTO sensor_readings (date, time, temperature, humidity) VALUES (?, TIME '12:00', 20, 50)",
        Date.valueOf(day));
    jdbcTemplate.update(
        "INSERT INTO sensor_readings (date, time, temperature, humidity) VALUES (?, TIME '06:00', 15, 60)",
        Date.valueOf(day));
    jdbcTemplate.update(
        "INSERT INTO sensor_readings (date, time, temperature, humidity) VALUES (?, TIME '07:00', 30, 10)",
        Date.valueOf(day.plusDays(1)));

    List<Double> temperatures = jdbcTemplate.queryForList(
        "SELECT temperature FROM get_sensor_readings_by_date(?)", Double.class, Date.valueOf(day));

    assertThat(temperatures).containsExactly(15.0, 20.0);
  }
}
