package io.dana.cert.operator.model;

import lombok.Data;

@Data
public class CertificateConfigSpec {
  /** Secret holding the credentials for the certificate API. */
  SecretRef secretRef = new SecretRef();

  /** Number of days before expiry at which the certificate is renewed. */
  int daysBeforeRenewal;

  /** Maximum time to wait for the certificate API, e.g. {@code 30s} or {@code 1m30s}. */
  String waitTimeout;

  /** Refresh the validity dates of a still valid certificate on every reconcile. */
  boolean forceExpirationUpdate;

  /** Skip TLS verification towards the certificate API. Defaults to true when unset. */
  Boolean insecureSkipTlsVerify;
}
