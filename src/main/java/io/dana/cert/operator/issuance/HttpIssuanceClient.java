package io.dana.cert.operator.issuance;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;

import java.time.Duration;
import java.util.Map;

import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.CertificateArchive;
import io.dana.cert.operator.model.CertificateRequest;
import io.dana.cert.operator.model.CertificateValidity;
import io.dana.cert.operator.model.IssueResponse;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import static io.dana.cert.operator.issuance.IssuanceException.Kind.PROTOCOL;

/**
 * Talks to the certificate API over HTTP with a bearer token.
 */
@Slf4j
public class HttpIssuanceClient implements IssuanceClient {
  // Strict RFC 8259 parsing; lenient Gson would accept bodies that are not JSON.
  final static private Gson gson = new GsonBuilder().setStrictness(Strictness.STRICT).create();

  final static String ERR_BODY_IS_NOT_JSON = "response body is not JSON";
  final static String ERR_FAILED_TO_UNMARSHAL_BODY = "failed to unmarshal response body: ";
  final static String ERR_POST_TO_CERT_FAILED = "POST to cert failed: ";
  final static String ERR_DOWNLOAD_FAILED = "download request to Cert API failed: ";
  final static String ERR_GET_DATA_FAILED = "GET request to Cert API failed: ";

  final private HttpTransport transport;
  @Getter
  final private String apiEndpoint;
  @Getter
  final private String downloadEndpoint;
  @Getter
  final private String token;
  @Getter
  final private Duration timeout;
  @Getter
  final private boolean skipTlsVerify;

  @Builder
  public HttpIssuanceClient(HttpTransport transport,
                            String apiEndpoint,
                            String downloadEndpoint,
                            String token,
                            Duration timeout,
                            boolean skipTlsVerify) {
    this.transport = transport;
    this.apiEndpoint = apiEndpoint;
    this.downloadEndpoint = downloadEndpoint;
    this.token = token;
    this.timeout = timeout;
    this.skipTlsVerify = skipTlsVerify;
  }

  @Override
  public String issue(Certificate certificate) {
    val body = gson.toJson(CertificateRequest.from(certificate.getSpec().getCertificateData()));

    final String response;
    try {
      response = transport.send("POST", apiEndpoint, body, headers(), skipTlsVerify, timeout);
    } catch (IssuanceException e) {
      throw e.withPrefix(ERR_POST_TO_CERT_FAILED);
    }

    val guid = parseResponseBody(response, IssueResponse.class).getTaskId();
    log.info("Certificate {} issued with task id {}", certificate.getMetadata().getName(), guid);
    return guid;
  }

  @Override
  public CertificateValidity fetchValidity(Certificate certificate) {
    val url = apiEndpoint + certificate.getStatus().getGuid();

    final String response;
    try {
      response = transport.send("GET", url, "", headers(), skipTlsVerify, timeout);
    } catch (IssuanceException e) {
      throw e.withPrefix(ERR_GET_DATA_FAILED);
    }

    return parseResponseBody(response, CertificateValidity.class);
  }

  @Override
  public CertificateArchive download(Certificate certificate) {
    val url = apiEndpoint + certificate.getStatus().getGuid() + downloadEndpoint
        + certificate.getSpec().getCertificateData().getForm();

    final String response;
    try {
      response = transport.send("GET", url, "", headers(), skipTlsVerify, timeout);
    } catch (IssuanceException e) {
      throw e.withPrefix(ERR_DOWNLOAD_FAILED);
    }

    return parseResponseBody(response, CertificateArchive.class);
  }

  private Map<String, String> headers() {
    return ImmutableMap.of(
        "Authorization", "Bearer " + token,
        "Accept", "application/json");
  }

  @VisibleForTesting
  static <T> T parseResponseBody(String body, Class<T> type) {
    if (!isJsonObject(body)) {
      throw new IssuanceException(PROTOCOL, ERR_FAILED_TO_UNMARSHAL_BODY + ERR_BODY_IS_NOT_JSON);
    }

    try {
      return gson.fromJson(body, type);
    } catch (JsonParseException e) {
      throw new IssuanceException(PROTOCOL, ERR_FAILED_TO_UNMARSHAL_BODY + e.getMessage(), e);
    }
  }

  @VisibleForTesting
  static boolean isJsonObject(String body) {
    if (body == null) {
      return false;
    }

    try {
      final JsonElement element = gson.fromJson(body, JsonElement.class);
      return element != null && element.isJsonObject();
    } catch (JsonParseException e) {
      return false;
    }
  }
}
