package com.ibprovider.connector;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyStore;
import java.time.Duration;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import org.junit.jupiter.api.Test;

class WapiHttpClientsTest {
  private static final char[] KEYSTORE_PASSWORD = "changeit".toCharArray();

  @Test
  void appliesConnectTimeout() {
    HttpClient client = WapiHttpClients.create(new TransportConfig(true, Duration.ofSeconds(60), null));

    assertThat(client.connectTimeout()).hasValue(Duration.ofSeconds(60));
    assertThat(client.followRedirects()).isEqualTo(HttpClient.Redirect.NEVER);
  }

  @Test
  void installsDedicatedTlsContextWhenVerificationIsDisabled() throws Exception {
    HttpClient client = WapiHttpClients.create(new TransportConfig(false, Duration.ofSeconds(5), null));

    assertThat(client.sslContext()).isNotSameAs(SSLContext.getDefault());
  }

  @Test
  void acceptsSelfSignedCertificateIssuedForAnotherHost() throws Exception {
    // Certificate subject is CN=gm.other.example while the client dials 127.0.0.1.
    HttpsServer server = HttpsServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.setHttpsConfigurator(new HttpsConfigurator(serverContext()));
    server.createContext("/wapi/v2.7/network", exchange -> {
      byte[] body = "[]".getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.start();
    try {
      HttpClient client = WapiHttpClients.create(new TransportConfig(false, Duration.ofSeconds(5), null));
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create("https://127.0.0.1:" + server.getAddress().getPort() + "/wapi/v2.7/network"))
          .timeout(Duration.ofSeconds(10))
          .GET()
          .build();

      HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

      assertThat(response.statusCode()).isEqualTo(200);
      assertThat(response.body()).isEqualTo("[]");
    } finally {
      server.stop(0);
    }
  }

  private SSLContext serverContext() throws Exception {
    KeyStore keyStore = KeyStore.getInstance("PKCS12");
    try (InputStream in = getClass().getResourceAsStream("/tls/other-host.p12")) {
      keyStore.load(in, KEYSTORE_PASSWORD);
    }
    KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    keyManagerFactory.init(keyStore, KEYSTORE_PASSWORD);
    SSLContext context = SSLContext.getInstance("TLS");
    context.init(keyManagerFactory.getKeyManagers(), null, null);
    return context;
  }
}
