package io.dana.cert.operator.kubernetes;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.CertificateConfig;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

/**
 * Reads and writes Certificate and CertificateConfig resources in the Kubernetes API.
 */
@Slf4j
public class CertificateManager {
  final private KubernetesClient client;

  public CertificateManager(KubernetesClient client) {
    this.client = client;
  }

  public Optional<CertificateConfig> getCertificateConfig(String name) {
    return Optional.ofNullable(client.resources(CertificateConfig.class).withName(name).get());
  }

  /**
   * Writes the status of the certificate. The new resource version is copied back so later
   * writes in the same reconcile do not conflict with this one.
   *
   * @throws io.fabric8.kubernetes.client.KubernetesClientException on conflicts or API errors
   */
  public void updateStatus(Certificate certificate) {
    val updated = client.resource(certificate).updateStatus();
    if (updated != null && updated.getMetadata() != null) {
      certificate.getMetadata().setResourceVersion(updated.getMetadata().getResourceVersion());
    }
    log.debug("Updated status of certificate {}/{}",
        certificate.getMetadata().getNamespace(), certificate.getMetadata().getName());
  }

  public boolean secretExists(String namespace, String secretName) {
    return client.secrets().inNamespace(namespace).withName(secretName).get() != null;
  }

  /** Lists the certificates in all namespaces that reference the given CertificateConfig. */
  public List<Certificate> listCertificatesReferencing(String configName) {
    return client.resources(Certificate.class).inAnyNamespace().list().getItems().stream()
        .filter(certificate -> certificate.getSpec() != null
            && certificate.getSpec().getConfigRef() != null
            && Objects.equals(configName, certificate.getSpec().getConfigRef().getName()))
        .collect(Collectors.toList());
  }
}
