package com.ospicorp.sensorapi.readings.service;

import com.ospicorp.sensorapi.readings.model.SensorReading;
import com.ospicorp.sensorapi.readings.model.SensorReadingRequest;
import com.ospicorp.sensorapi.readings.model.SensorReadingUpdateRequest;
import com.ospicorp.sensorapi.readings.repository.SensorReadingDao;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class SensorReadingService {
  private static final Logger log = LoggerFactory.getLogger(SensorReadingService.class);

  private final SensorReadingDao dao;
  private final int defaultLimit;
  private final int maxLimit;

  public SensorReadingService(SensorReadingDao dao,
      @Value("${sensor.readings.default-limit:100}") int defaultLimit,
      @Value("${sensor.readings.max-limit:1000}") int maxLimit) {
    if (defaultLimit < 1 || maxLimit < defaultLimit) {
      throw new IllegalStateException("sensor.readings limits must satisfy 1 <= default-limit <= max-limit");
    }
    this.dao = dao;
    this.defaultLimit = defaultLimit;
    this.maxLimit = maxLimit;
  }

  public List<SensorReading> list(LocalDate date, String rawPage, String rawLimit) {
    PageWindow window = PageWindow.parse(rawPage, rawLimit, defaultLimit, maxLimit);
    return execute(ReadingOperation.LIST, () -> date == null
        ? dao.findPage(window.limit(), window.offset())
        : dao.findPageByDate(date, window.limit(), window.offset()));
  }

  public List<SensorReading> listByDate(LocalDate date) {
    Objects.requireNonNull(date, "date");
    return execute(ReadingOperation.LIST_BY_DATE, () -> dao.findByDateViaRoutine(date));
  }

  public SensorReading get(long id) {
    return execute(ReadingOperation.FIND, () -> dao.findById(id))
        .orElseThrow(() -> notFound(id));
  }

  public long create(SensorReadingRequest request) {
    LocalTime time = request.time() != null
        ? request.time()
        : LocalTime.now().truncatedTo(ChronoUnit.SECONDS);
    long id = execute(ReadingOperation.CREATE, () -> dao.insert(request.date(), time,
        request.temperature(), request.humidity()));
    log.debug("Added sensor reading {} for {}", id, request.date());
    return id;
  }

  public int updateMatching(SensorReadingUpdateRequest request) {
    int updated = execute(ReadingOperation.UPDATE, () -> dao.updateMatching(request.date(),
        request.temperature(), request.humidity(),
        request.targetTemperature(), request.targetHumidity()));
    log.debug("Value-matched update on {} affected {} row(s)", request.date(), updated);
    return updated;
  }

  public int deleteMatching(SensorReadingRequest request) {
    int deleted = execute(ReadingOperation.DELETE, () -> dao.deleteMatching(request.date(),
        request.temperature(), request.humidity()));
    log.debug("Value-matched delete on {} removed {} row(s)", request.date(), deleted);
    return deleted;
  }

  public void update(long id, SensorReadingRequest request) {
    int updated = execute(ReadingOperation.UPDATE, () -> dao.updateById(id, request.date(),
        request.time(), request.temperature(), request.humidity()));
    if (updated == 0) {
      throw notFound(id);
    }
  }

  public void delete(long id) {
    int deleted = execute(ReadingOperation.DELETE, () -> dao.deleteById(id));
    if (deleted == 0) {
      throw notFound(id);
    }
  }

  private static <T> T execute(ReadingOperation operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException ex) {
      throw new ReadingOperationException(operation, ex);
    }
  }

  private static NoSuchElementException notFound(long id) {
    return new NoSuchElementException("Sensor reading not found: " + id);
  }
}
