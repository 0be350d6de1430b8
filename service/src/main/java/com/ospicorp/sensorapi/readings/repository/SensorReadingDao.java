package com.ospicorp.sensorapi.readings.repository;

import com.ospicorp.sensorapi.readings.model.SensorReading;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Parameterized SQL over {@code sensor_readings}. Every method is a single statement on the
 * injected pool; failures surface as Spring {@code DataAccessException}s.
 */
@Repository
public class SensorReadingDao {
  private static final String COLUMNS = "id, date, time, temperature, humidity";

  private static final RowMapper<SensorReading> ROW_MAPPER = SensorReadingDao::mapRow;

  private final JdbcTemplate jdbc;

  public SensorReadingDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public List<SensorReading> findPage(long limit, long offset) {
    String sql = """
      SELECT %s
      FROM sensor_readings
      ORDER BY date, time, id
      LIMIT ? OFFSET ?
    """.formatted(COLUMNS);
    return jdbc.query(sql, ROW_MAPPER, limit, offset);
  }

  public List<SensorReading> findPageByDate(LocalDate date, long limit, long offset) {
    String sql = """
      SELECT %s
      FROM sensor_readings
      WHERE date = ?
      ORDER BY time, id
      LIMIT ? OFFSET ?
    """.formatted(COLUMNS);
    return jdbc.query(sql, ROW_MAPPER, date, limit, offset);
  }

  public List<SensorReading> findByDateViaRoutine(LocalDate date) {
    String sql = "SELECT " + COLUMNS + " FROM get_sensor_readings_by_date(?)";
    return jdbc.query(sql, ROW_MAPPER, date);
  }

  public Optional<SensorReading> findById(long id) {
    String sql = "SELECT " + COLUMNS + " FROM sensor_readings WHERE id = ?";
    return jdbc.query(sql, ROW_MAPPER, id).stream().findFirst();
  }

  public long insert(LocalDate date, LocalTime time, double temperature, double humidity) {
    String sql = """
      INSERT INTO sensor_readings (date, time, temperature, humidity)
      VALUES (?, ?, ?, ?)
      RETURNING id
    """;
    Long id = jdbc.queryForObject(sql, Long.class, date, time, temperature, humidity);
    if (id == null) {
      throw new IllegalStateException("Insert into sensor_readings returned no id");
    }
    return id;
  }

  public int updateMatching(LocalDate date, double temperature, double humidity,
      double newTemperature, double newHumidity) {
    String sql = """
      UPDATE sensor_readings
      SET temperature = ?, humidity = ?
      WHERE date = ? AND temperature = ? AND humidity = ?
    """;
    return jdbc.update(sql, newTemperature, newHumidity, date, temperature, humidity);
  }

  public int deleteMatching(LocalDate date, double temperature, double humidity) {
    String sql = "DELETE FROM sensor_readings WHERE date = ? AND temperature = ? AND humidity = ?";
    return jdbc.update(sql, date, temperature, humidity);
  }

  public int updateById(long id, LocalDate date, LocalTime time, double temperature,
      double humidity) {
    if (time == null) {
      return jdbc.update(
          "UPDATE sensor_readings SET date = ?, temperature = ?, humidity = ? WHERE id = ?",
          date, temperature, humidity, id);
    }
    return jdbc.update(
        "UPDATE sensor_readings SET date = ?, time = ?, temperature = ?, humidity = ? WHERE id = ?",
        date, time, temperature, humidity, id);
  }

  public int deleteById(long id) {
    return jdbc.update("DELETE FROM sensor_readings WHERE id = ?", id);
  }

  private static SensorReading mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SensorReading(
        rs.getLong("id"),
        rs.getObject("date", LocalDate.class),
        rs.getObject("time", LocalTime.class),
        (Double) rs.getObject("temperature"),
        (Double) rs.getObject("humidity"));
  }
}
