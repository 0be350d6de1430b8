package com.ospicorp.sensorapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(@Value("${sensor.api.server-url:http://localhost:3000}") String serverUrl) {
    return new OpenAPI()
        .info(new Info()
            .title("Sensor API")
            .version("1.0.0")
            .description("API documentation for the sensor readings service"))
        .servers(List.of(new Server().url(serverUrl)));
  }
}
