package io.dana.cert.operator.model;

import lombok.Value;

/**
 * Validity data of an issued certificate as returned by the certificate API.
 *
 * Timestamps use the literal format {@code yyyy-MM-dd'T'HH:mm:ss} without a zone.
 */
@Value
public class CertificateValidity {
  String validTo;
  String validFrom;
  String signatureHashAlgorithm;
}
