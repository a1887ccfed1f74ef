package io.dana.cert.operator.tls;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when a downloaded archive cannot be decoded.
 */
public class DecodeException extends CertificateOperatorException {
  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
