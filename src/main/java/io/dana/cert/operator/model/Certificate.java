package io.dana.cert.operator.model;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A request for a certificate from the certificate API, stored as a TLS secret once issued.
 */
@Group(Constants.GROUP)
@Version(Constants.VERSION)
@Kind("Certificate")
public class Certificate extends CustomResource<CertificateSpec, CertificateStatus>
    implements Namespaced {

  @Override
  protected CertificateSpec initSpec() {
    return new CertificateSpec();
  }

  @Override
  protected CertificateStatus initStatus() {
    return new CertificateStatus();
  }
}
