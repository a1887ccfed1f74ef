package io.dana.cert.operator.model;

import lombok.Value;

/**
 * A PEM encoded certificate and private key, ready to be stored in a TLS secret.
 */
@Value
public class TlsMaterial {
  byte[] certificateBytes;
  byte[] privateKeyBytes;
}
