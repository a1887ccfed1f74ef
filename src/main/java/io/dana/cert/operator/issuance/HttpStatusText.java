package io.dana.cert.operator.issuance;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Standard reason phrases of HTTP status codes.
 *
 * HTTP/2 responses carry no reason phrase, so the text is derived from the code.
 */
final class HttpStatusText {
  final static private Map<Integer, String> TEXTS = ImmutableMap.<Integer, String>builder()
      .put(201, "Created")
      .put(202, "Accepted")
      .put(204, "No Content")
      .put(301, "Moved Permanently")
      .put(302, "Found")
      .put(304, "Not Modified")
      .put(307, "Temporary Redirect")
      .put(308, "Permanent Redirect")
      .put(400, "Bad Request")
      .put(401, "Unauthorized")
      .put(402, "Payment Required")
      .put(403, "Forbidden")
      .put(404, "Not Found")
      .put(405, "Method Not Allowed")
      .put(406, "Not Acceptable")
      .put(408, "Request Timeout")
      .put(409, "Conflict")
      .put(410, "Gone")
      .put(412, "Precondition Failed")
      .put(413, "Request Entity Too Large")
      .put(415, "Unsupported Media Type")
      .put(422, "Unprocessable Entity")
      .put(429, "Too Many Requests")
      .put(500, "Internal Server Error")
      .put(501, "Not Implemented")
      .put(502, "Bad Gateway")
      .put(503, "Service Unavailable")
      .put(504, "Gateway Timeout")
      .build();

  private HttpStatusText() {
  }

  static String of(int statusCode) {
    return TEXTS.getOrDefault(statusCode, "");
  }
}
