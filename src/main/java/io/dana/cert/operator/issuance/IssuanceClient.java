package io.dana.cert.operator.issuance;

import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.CertificateArchive;
import io.dana.cert.operator.model.CertificateValidity;

/**
 * The operations of the external certificate API.
 *
 * All operations throw {@link IssuanceException} on failure. A certificate the API does not
 * know (yet) is reported as a PROTOCOL failure whose message contains {@code Not Found}.
 */
public interface IssuanceClient {
  /**
   * Requests a new certificate for the subject, SANs and template of the given certificate.
   * Returns the task id that identifies the certificate in later calls.
   */
  String issue(Certificate certificate);

  /** Fetches the validity of the certificate identified by {@code status.guid}. */
  CertificateValidity fetchValidity(Certificate certificate);

  /** Downloads the certificate identified by {@code status.guid} in {@code spec.form}. */
  CertificateArchive download(Certificate certificate);
}
