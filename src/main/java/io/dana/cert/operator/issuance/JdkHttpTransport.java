package io.dana.cert.operator.issuance;

import com.google.common.annotations.VisibleForTesting;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Map;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;

import lombok.extern.slf4j.Slf4j;
import lombok.val;

import static io.dana.cert.operator.issuance.IssuanceException.Kind.PROTOCOL;
import static io.dana.cert.operator.issuance.IssuanceException.Kind.TRANSPORT;

/**
 * {@link HttpTransport} on top of the JDK HTTP client.
 *
 * A client is built for every request so the TLS verification toggle and the timeout apply per
 * call.
 */
@Slf4j
public class JdkHttpTransport implements HttpTransport {
  final static private TrustManager[] INSECURE_TRUST_MANAGERS = {new InsecureTrustManager()};

  @Override
  public String send(String method, String url, String body, Map<String, String> headers,
                     boolean skipTlsVerify, Duration timeout) {
    final HttpRequest request = buildRequest(method, url, body, headers, timeout);
    final HttpClient.Builder clientBuilder = HttpClient.newBuilder()
        .sslContext(sslContext(skipTlsVerify));
    if (hasTimeout(timeout)) {
      clientBuilder.connectTimeout(timeout);
    }
    final HttpClient client = clientBuilder.build();

    final HttpResponse<String> response;
    try {
      response = client.send(request, BodyHandlers.ofString());
      log.info("http request sent: {} {}", method, url);
    } catch (IOException e) {
      throw new IssuanceException(TRANSPORT,
          String.format("http request to \"%s\" failed: %s", url, e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IssuanceException(TRANSPORT,
          String.format("http request to \"%s\" interrupted", url), e);
    }

    if (response.statusCode() != 200) {
      log.info("request failed, method: {}, status code: {}, body: {}",
          method, response.statusCode(), response.body());
      throw new IssuanceException(PROTOCOL, HttpStatusText.of(response.statusCode()));
    }

    return response.body();
  }

  // A zero or negative wait timeout means the call never times out.
  @VisibleForTesting
  static boolean hasTimeout(Duration timeout) {
    return timeout != null && !timeout.isZero() && !timeout.isNegative();
  }

  private static HttpRequest buildRequest(String method, String url, String body,
                                          Map<String, String> headers, Duration timeout) {
    final HttpRequest.Builder builder;
    try {
      builder = HttpRequest.newBuilder(URI.create(url));
    } catch (IllegalArgumentException e) {
      throw new IssuanceException(TRANSPORT, "invalid request URL \"" + url + "\": "
          + e.getMessage(), e);
    }
    if (hasTimeout(timeout)) {
      builder.timeout(timeout);
    }

    headers.forEach(builder::header);
    val publisher = body == null || body.isEmpty()
        ? BodyPublishers.noBody()
        : BodyPublishers.ofString(body);
    return builder.method(method, publisher).build();
  }

  private static SSLContext sslContext(boolean skipTlsVerify) {
    try {
      if (!skipTlsVerify) {
        return SSLContext.getDefault();
      }

      final SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, INSECURE_TRUST_MANAGERS, new SecureRandom());
      return context;
    } catch (GeneralSecurityException e) {
      throw new IssuanceException(TRANSPORT, "cannot set up TLS: " + e.getMessage(), e);
    }
  }
}
