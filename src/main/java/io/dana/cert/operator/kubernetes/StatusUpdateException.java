package io.dana.cert.operator.kubernetes;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when the status of a certificate cannot be written.
 */
public class StatusUpdateException extends CertificateOperatorException {
  public StatusUpdateException(String message, Throwable cause) {
    super(message, cause);
  }
}
