package io.dana.cert.operator.issuance;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import lombok.val;

import static io.dana.cert.operator.issuance.IssuanceException.Kind.PROTOCOL;
import static io.dana.cert.operator.issuance.IssuanceException.Kind.TRANSPORT;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class JdkHttpTransportTest {
  final static private Duration TIMEOUT = Duration.ofSeconds(5);

  final private JdkHttpTransport transport = new JdkHttpTransport();
  final private AtomicReference<String> authorization = new AtomicReference<>();
  final private AtomicReference<String> requestBody = new AtomicReference<>();

  private HttpServer server;
  private String baseUrl;

  @Before
  public void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/certificates", exchange -> {
      authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
      requestBody.set(new String(ByteStreams.toByteArray(exchange.getRequestBody()),
          StandardCharsets.UTF_8));
      respond(exchange, 200, "{\"taskId\":\"42\"}");
    });
    server.createContext("/missing", exchange -> respond(exchange, 404, "no such task"));
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @After
  public void stopServer() {
    server.stop(0);
  }

  @Test
  public void testSendsHeadersAndBody() {
    val response = transport.send("POST", baseUrl + "/certificates", "{\"template\":\"web\"}",
        ImmutableMap.of("Authorization", "Bearer t0ken"), true, TIMEOUT);

    assertEquals("{\"taskId\":\"42\"}", response);
    assertEquals("Bearer t0ken", authorization.get());
    assertEquals("{\"template\":\"web\"}", requestBody.get());
  }

  @Test
  public void testNotFoundIsProtocolError() {
    val e = assertThrows(IssuanceException.class, () -> transport.send("GET",
        baseUrl + "/missing", "", ImmutableMap.of(), false, TIMEOUT));

    assertEquals(PROTOCOL, e.getKind());
    assertEquals("Not Found", e.getMessage());
  }

  @Test
  public void testConnectionFailureIsTransportError() throws IOException {
    final int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    val e = assertThrows(IssuanceException.class, () -> transport.send("GET",
        "http://127.0.0.1:" + port + "/certificates", "", ImmutableMap.of(), true, TIMEOUT));

    assertEquals(TRANSPORT, e.getKind());
  }

  @Test
  public void testInvalidUrlIsTransportError() {
    val e = assertThrows(IssuanceException.class, () -> transport.send("GET",
        "not a url", "", ImmutableMap.of(), true, TIMEOUT));

    assertEquals(TRANSPORT, e.getKind());
    assertThat(e.getMessage(), startsWith("invalid request URL \"not a url\": "));
  }

  @Test
  public void testZeroTimeoutMeansNoTimeout() {
    val response = transport.send("POST", baseUrl + "/certificates", "{}",
        ImmutableMap.of(), true, Duration.ZERO);

    assertEquals("{\"taskId\":\"42\"}", response);
  }

  @Test
  public void testNegativeTimeoutMeansNoTimeout() {
    val response = transport.send("POST", baseUrl + "/certificates", "{}",
        ImmutableMap.of(), true, Duration.ofSeconds(-1));

    assertEquals("{\"taskId\":\"42\"}", response);
  }

  @Test
  public void testHasTimeout() {
    assertTrue(JdkHttpTransport.hasTimeout(Duration.ofMillis(1)));
    assertFalse(JdkHttpTransport.hasTimeout(Duration.ZERO));
    assertFalse(JdkHttpTransport.hasTimeout(Duration.ofMinutes(-1)));
    assertFalse(JdkHttpTransport.hasTimeout(null));
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    val bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
