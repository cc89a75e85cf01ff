package com.ibprovider.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibprovider.connector.AuthConfig;
import com.ibprovider.connector.HostConfig;
import com.ibprovider.connector.IbConnector;
import com.ibprovider.connector.TransportConfig;
import com.ibprovider.connector.WapiConnector;
import com.ibprovider.connector.WapiEndpointProvider;
import com.ibprovider.connector.WapiHttpClients;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public TransportConfig transportConfig(InfobloxProperties properties) {
    return new TransportConfig(
        properties.sslVerify(),
        positiveSeconds(properties.connectTimeoutSeconds()),
        positiveSeconds(properties.requestTimeoutSeconds()));
  }

  @Bean
  public HttpClient httpClient(TransportConfig transportConfig) {
    return WapiHttpClients.create(transportConfig);
  }

  @Bean
  public WapiEndpointProvider wapiEndpointProvider(InfobloxProperties properties) {
    return new WapiEndpointProvider(
        new HostConfig(properties.server(), properties.port(), properties.wapiVersion()));
  }

  @Bean
  public IbConnector ibConnector(
      WapiEndpointProvider endpointProvider,
      InfobloxProperties properties,
      TransportConfig transportConfig,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    return new WapiConnector(
        endpointProvider,
        new AuthConfig(properties.username(), properties.password()),
        transportConfig,
        meterRegistry,
        httpClient,
        objectMapper);
  }

  private Duration positiveSeconds(long seconds) {
    return seconds > 0 ? Duration.ofSeconds(seconds) : null;
  }
}
