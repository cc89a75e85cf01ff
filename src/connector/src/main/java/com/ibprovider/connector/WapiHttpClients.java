package com.ibprovider.connector;

import java.net.Socket;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the {@link HttpClient} used to reach the appliance. */
public final class WapiHttpClients {
  private static final Logger log = LoggerFactory.getLogger(WapiHttpClients.class);

  private WapiHttpClients() {}

  public static HttpClient create(TransportConfig transportConfig) {
    HttpClient.Builder builder = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER);
    if (transportConfig == null) {
      return builder.build();
    }
    if (transportConfig.connectTimeout() != null) {
      builder.connectTimeout(transportConfig.connectTimeout());
    }
    if (!transportConfig.sslVerify()) {
      // Appliances commonly ship a self-signed certificate issued for another name.
      log.warn("TLS certificate verification disabled for Infoblox WAPI connections");
      builder.sslContext(trustAllContext());
    }
    return builder.build();
  }

  private static SSLContext trustAllContext() {
    // The extended variant stops JSSE from adding its own endpoint identification check.
    TrustManager[] trustAll = {
      new X509ExtendedTrustManager() {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public X509Certificate[] getAcceptedIssuers() {
          return new X509Certificate[0];
        }
      }
    };
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, trustAll, new SecureRandom());
      return context;
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Unable to initialise TLS context", ex);
    }
  }
}
