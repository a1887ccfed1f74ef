package io.dana.cert.operator.model;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Cluster-scoped settings shared by certificates: credentials, renewal window and timeouts.
 */
@Group(Constants.GROUP)
@Version(Constants.VERSION)
@Kind("CertificateConfig")
public class CertificateConfig extends CustomResource<CertificateConfigSpec, Void> {

  @Override
  protected CertificateConfigSpec initSpec() {
    return new CertificateConfigSpec();
  }
}
