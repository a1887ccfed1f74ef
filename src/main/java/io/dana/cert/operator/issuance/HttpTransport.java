package io.dana.cert.operator.issuance;

import java.time.Duration;
import java.util.Map;

/**
 * Sends a single HTTP request and returns the body of a 200 response.
 */
public interface HttpTransport {
  /**
   * @throws IssuanceException TRANSPORT if no response was received, PROTOCOL with the status
   *                           text as message if the status is not 200
   */
  String send(String method, String url, String body, Map<String, String> headers,
              boolean skipTlsVerify, Duration timeout);
}
