package com.ibprovider.connector;

public record AuthConfig(String username, String password) {
  @Override
  public String toString() {
    return "AuthConfig[username=" + username + ", password=****]";
  }
}
