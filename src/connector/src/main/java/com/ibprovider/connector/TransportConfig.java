package com.ibprovider.connector;

import java.time.Duration;

public record TransportConfig(boolean sslVerify, Duration connectTimeout, Duration requestTimeout) {}
