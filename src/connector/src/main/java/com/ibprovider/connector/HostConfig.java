package com.ibprovider.connector;

public record HostConfig(String host, String port, String version) {}
