package io.dana.cert.operator.util;

/**
 * A runtime exception to be thrown if anything goes wrong while reconciling a certificate.
 *
 * The message is recorded verbatim on the certificate's Error condition.
 */
public class CertificateOperatorException extends RuntimeException {
  public CertificateOperatorException(String message) {
    super(message);
  }

  public CertificateOperatorException(String message, Throwable cause) {
    super(message, cause);
  }
}
