package io.dana.cert.operator.issuance;

import io.dana.cert.operator.util.CertificateOperatorException;
import lombok.Getter;

/**
 * Thrown when a call to the certificate API fails.
 */
public class IssuanceException extends CertificateOperatorException {
  public enum Kind {
    /** The request could not be sent or no response was received. */
    TRANSPORT,
    /** A response was received but had a non-200 status or an unusable body. */
    PROTOCOL
  }

  @Getter
  final private Kind kind;

  public IssuanceException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public IssuanceException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /** Wraps this exception with a prefix, keeping its kind. */
  public IssuanceException withPrefix(String prefix) {
    return new IssuanceException(kind, prefix + getMessage(), this);
  }
}
