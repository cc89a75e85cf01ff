package com.ibprovider.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infoblox")
public record InfobloxProperties(
    String server,
    String port,
    String username,
    String password,
    String wapiVersion,
    boolean sslVerify,
    long connectTimeoutSeconds,
    long requestTimeoutSeconds) {

  @Override
  public String toString() {
    return "InfobloxProperties[server=" + server + ", port=" + port + ", username=" + username
        + ", password=****, wapiVersion=" + wapiVersion + ", sslVerify=" + sslVerify + "]";
  }
}
