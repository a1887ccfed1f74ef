package io.dana.cert.operator.kubernetes;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when a CertificateConfig is deleted while certificates still reference it.
 */
public class DependentCertificatesException extends CertificateOperatorException {
  public DependentCertificatesException(String message) {
    super(message);
  }
}
