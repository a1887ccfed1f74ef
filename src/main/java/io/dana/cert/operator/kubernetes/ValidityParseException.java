package io.dana.cert.operator.kubernetes;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when a validity timestamp returned by the certificate API cannot be parsed.
 */
public class ValidityParseException extends CertificateOperatorException {
  public ValidityParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
