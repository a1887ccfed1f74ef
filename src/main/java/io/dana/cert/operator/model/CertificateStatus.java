package io.dana.cert.operator.model;

import java.util.ArrayList;
import java.util.List;

import io.fabric8.kubernetes.api.model.Condition;
import lombok.Data;

/**
 * Observed state of a {@link Certificate}.
 *
 * validFrom and validTo are RFC 3339 timestamps in UTC and are always written together.
 */
@Data
public class CertificateStatus {
  List<Condition> conditions = new ArrayList<>();
  String validFrom;
  String validTo;
  String issuer;

  /** Task id returned by the certificate API for the latest issuance. */
  String guid;

  String signatureHashAlgorithm;

  /** Name of the secret the certificate was last written to. */
  String secretName;
}
