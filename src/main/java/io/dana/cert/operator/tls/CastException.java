package io.dana.cert.operator.tls;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when an archive holds a private key of an unsupported type.
 */
public class CastException extends CertificateOperatorException {
  public CastException(String message) {
    super(message);
  }
}
