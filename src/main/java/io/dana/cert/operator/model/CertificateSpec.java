package io.dana.cert.operator.model;

import lombok.Data;

/**
 * Desired state of a {@link Certificate}.
 */
@Data
public class CertificateSpec {
  /** Subject, SANs, template and archive form sent to the certificate API. */
  CertificateData certificateData = new CertificateData();

  /** The name of the Kubernetes secret to store the certificate in. */
  String secretName;

  /** The cluster-scoped CertificateConfig to issue with. */
  ConfigReference configRef = new ConfigReference();
}
