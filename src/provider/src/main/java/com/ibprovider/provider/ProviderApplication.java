package com.ibprovider.provider;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProviderApplication {
  // Main entrypoint: serves the Infoblox data sources over HTTP.
  public static void main(String[] args) {
    SpringApplication.run(ProviderApplication.class, args);
  }
}
