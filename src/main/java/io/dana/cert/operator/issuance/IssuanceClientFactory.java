package io.dana.cert.operator.issuance;

import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import io.dana.cert.operator.model.CertificateConfig;
import io.dana.cert.operator.model.CertificateConfigSpec;
import io.dana.cert.operator.util.Durations;
import lombok.val;

import static io.dana.cert.operator.model.Constants.CREDENTIALS_KEY;

/**
 * Builds an {@link IssuanceClient} from a CertificateConfig and the data of its credentials
 * secret.
 *
 * Clients are never cached: each reconcile builds a new one so rotated credentials take effect
 * immediately.
 */
public class IssuanceClientFactory {
  final static private Gson gson = new Gson();
  final static private BaseEncoding base64 = BaseEncoding.base64();

  final static Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMinutes(1);

  final static String KEY_API_ENDPOINT = "apiEndpoint";
  final static String KEY_DOWNLOAD_ENDPOINT = "downloadEndpoint";
  final static String KEY_TOKEN = "token";

  final static String ERR_MISSING_API_ENDPOINT = "missing API Endpoint in secret";
  final static String ERR_MISSING_DOWNLOAD_ENDPOINT = "missing Download API Endpoint in secret";
  final static String ERR_MISSING_TOKEN = "missing token in secret";
  final static String ERR_UNMARSHAL_CREDENTIALS = "cannot unmarshal credentials as JSON: ";

  final private HttpTransport transport;

  public IssuanceClientFactory(HttpTransport transport) {
    this.transport = transport;
  }

  /**
   * @param secretData the base64 encoded data of the credentials secret
   * @throws CredentialsException if the credentials are malformed or incomplete
   */
  public IssuanceClient create(CertificateConfig config, Map<String, String> secretData) {
    val credentials = readCredentials(secretData);

    val apiEndpoint = credentials.get(KEY_API_ENDPOINT);
    if (Strings.isNullOrEmpty(apiEndpoint)) {
      throw new CredentialsException(ERR_MISSING_API_ENDPOINT);
    }

    val downloadEndpoint = credentials.get(KEY_DOWNLOAD_ENDPOINT);
    if (Strings.isNullOrEmpty(downloadEndpoint)) {
      throw new CredentialsException(ERR_MISSING_DOWNLOAD_ENDPOINT);
    }

    val token = credentials.get(KEY_TOKEN);
    if (Strings.isNullOrEmpty(token)) {
      throw new CredentialsException(ERR_MISSING_TOKEN);
    }

    return HttpIssuanceClient.builder()
        .transport(transport)
        .apiEndpoint(apiEndpoint)
        .downloadEndpoint(downloadEndpoint)
        .token(token)
        .timeout(getWaitTimeout(config))
        .skipTlsVerify(getSkipTlsVerify(config))
        .build();
  }

  private static Map<String, String> readCredentials(Map<String, String> secretData) {
    val encoded = secretData == null ? null : secretData.get(CREDENTIALS_KEY);
    if (encoded == null) {
      throw new CredentialsException(ERR_UNMARSHAL_CREDENTIALS + "no " + CREDENTIALS_KEY
          + " key in secret");
    }

    try {
      val json = new String(base64.decode(encoded), StandardCharsets.UTF_8);
      final Map<String, String> credentials =
          gson.fromJson(json, new TypeToken<Map<String, String>>() {}.getType());
      if (credentials == null) {
        throw new CredentialsException(ERR_UNMARSHAL_CREDENTIALS + "empty credentials");
      }
      return credentials;
    } catch (IllegalArgumentException | JsonParseException e) {
      throw new CredentialsException(ERR_UNMARSHAL_CREDENTIALS + e.getMessage(), e);
    }
  }

  static Duration getWaitTimeout(CertificateConfig config) {
    val waitTimeout = spec(config).getWaitTimeout();
    if (Strings.isNullOrEmpty(waitTimeout)) {
      return DEFAULT_WAIT_TIMEOUT;
    }

    return Durations.parse(waitTimeout);
  }

  static boolean getSkipTlsVerify(CertificateConfig config) {
    val skip = spec(config).getInsecureSkipTlsVerify();
    return skip == null || skip;
  }

  private static CertificateConfigSpec spec(CertificateConfig config) {
    return config.getSpec() == null ? new CertificateConfigSpec() : config.getSpec();
  }
}
