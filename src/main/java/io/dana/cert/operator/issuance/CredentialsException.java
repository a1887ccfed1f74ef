package io.dana.cert.operator.issuance;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when the credentials for the certificate API are missing or malformed.
 */
public class CredentialsException extends CertificateOperatorException {
  public CredentialsException(String message) {
    super(message);
  }

  public CredentialsException(String message, Throwable cause) {
    super(message, cause);
  }
}
