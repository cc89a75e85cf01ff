package com.ibprovider.connector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WapiEndpointProvider {
  private static final Logger log = LoggerFactory.getLogger(WapiEndpointProvider.class);
  private static final String DEFAULT_PORT = "443";
  private static final String DEFAULT_VERSION = "2.7";

  private final HostConfig hostConfig;
  private String baseUrl;

  public WapiEndpointProvider(HostConfig hostConfig) {
    this.hostConfig = hostConfig;
  }

  /** Returns {@code https://host:port/wapi/vX.Y/}, resolved once and then reused. */
  public synchronized String baseUrl() {
    if (baseUrl != null) {
      return baseUrl;
    }
    if (hostConfig == null) {
      throw new IllegalStateException("Infoblox configuration missing: infoblox.server");
    }

    String host = required("infoblox.server", hostConfig.host());
    String port = orDefault(hostConfig.port(), DEFAULT_PORT);
    String version = orDefault(hostConfig.version(), DEFAULT_VERSION);
    if (!port.chars().allMatch(Character::isDigit)) {
      throw new IllegalStateException("Invalid infoblox.port '" + port + "'. Expected a number");
    }
    if (version.regionMatches(true, 0, "v", 0, 1)) {
      version = version.substring(1);
    }

    baseUrl = "https://" + host + ":" + port + "/wapi/v" + version + "/";
    log.info("Infoblox WAPI endpoint resolved: {}", baseUrl);
    return baseUrl;
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String orDefault(String value, String fallback) {
    return isPresent(value) ? value.trim() : fallback;
  }

  private String required(String field, String value) {
    if (!isPresent(value)) {
      throw new IllegalStateException("Infoblox configuration missing: " + field);
    }
    return value.trim();
  }
}
