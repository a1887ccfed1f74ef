package io.dana.cert.operator.kubernetes;

import io.dana.cert.operator.util.CertificateOperatorException;

/**
 * Thrown when an owner reference cannot be set on a dependent object.
 */
public class OwnerReferenceException extends CertificateOperatorException {
  public OwnerReferenceException(String message) {
    super(message);
  }
}
