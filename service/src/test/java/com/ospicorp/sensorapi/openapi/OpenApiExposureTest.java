package com.ospicorp.sensorapi.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.sensorapi.readings.repository.SensorReadingDao;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("nodb")
class OpenApiExposureTest {

  @Autowired
  private TestRestTemplate rest;

  @MockBean
  private SensorReadingDao dao;

  @Test
  void openapiYamlServed() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs.yaml", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("openapi:");
    assertThat(response.getBody()).contains("title: Sensor API");
    assertThat(response.getBody()).contains("/sensor-readings/procedure");
  }

  @Test
  void swaggerUiServedUnderApiDocs() {
    ResponseEntity<String> response = rest.getForEntity("/api-docs", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("Swagger UI");
  }
}
