package io.dana.cert.operator.kubernetes;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.BaseEncoding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.TlsMaterial;
import io.dana.cert.operator.util.CertificateOperatorException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import static io.dana.cert.operator.model.Constants.TLS_CERT_KEY;
import static io.dana.cert.operator.model.Constants.TLS_PRIVATE_KEY_KEY;
import static io.dana.cert.operator.model.Constants.TLS_SECRET_TYPE;

/**
 * Manages certificates in the form of TLS secrets in the Kubernetes API.
 */
@Slf4j
public class SecretManager {
  final static private BaseEncoding base64 = BaseEncoding.base64();

  final static String ERR_CREATING_SECRET = "cannot create secret \"%s\" in the namespace \"%s\": %s";
  final static String ERR_GETTING_SECRET = "cannot get secret \"%s\" in the namespace \"%s\": %s";
  final static String ERR_UPDATING_SECRET = "cannot update secret \"%s\" in the namespace \"%s\": %s";
  final static String ERR_CROSS_NAMESPACE = "cross-namespace owner references are disallowed, "
      + "owner's namespace %s, obj's namespace %s";

  final private KubernetesClient client;

  public SecretManager(KubernetesClient client) {
    this.client = client;
  }

  public Optional<Secret> getSecret(String namespace, String secretName) {
    return Optional.ofNullable(client.secrets().inNamespace(namespace).withName(secretName).get());
  }

  /**
   * Builds the TLS secret for a certificate. The data is base64 encoded as the API expects.
   */
  public static Secret tlsSecret(TlsMaterial material, Certificate certificate, String namespace) {
    return new SecretBuilder()
        .withNewMetadata()
          .withName(certificate.getSpec().getSecretName())
          .withNamespace(namespace)
        .endMetadata()
        .withType(TLS_SECRET_TYPE)
        .withData(ImmutableMap.of(
            TLS_CERT_KEY, base64.encode(material.getCertificateBytes()),
            TLS_PRIVATE_KEY_KEY, base64.encode(material.getPrivateKeyBytes())))
        .build();
  }

  /**
   * Makes the owner an owner of the object, so the object is garbage collected with it.
   * A reference to the same owner is replaced.
   *
   * @throws OwnerReferenceException if owner and object live in different namespaces
   */
  public static void setOwnerReference(HasMetadata owner, HasMetadata object) {
    val ownerNamespace = owner.getMetadata().getNamespace();
    val objectNamespace = object.getMetadata().getNamespace();

    if (!Strings.isNullOrEmpty(ownerNamespace) && !ownerNamespace.equals(objectNamespace)) {
      throw new OwnerReferenceException(
          String.format(ERR_CROSS_NAMESPACE, ownerNamespace, objectNamespace));
    }

    final OwnerReference reference = new OwnerReferenceBuilder()
        .withApiVersion(owner.getApiVersion())
        .withKind(owner.getKind())
        .withName(owner.getMetadata().getName())
        .withUid(owner.getMetadata().getUid())
        .build();

    final List<OwnerReference> references = new ArrayList<>();
    if (object.getMetadata().getOwnerReferences() != null) {
      object.getMetadata().getOwnerReferences().stream()
          .filter(existing -> !isSameOwner(existing, reference))
          .forEach(references::add);
    }
    references.add(reference);
    object.getMetadata().setOwnerReferences(references);
  }

  private static boolean isSameOwner(OwnerReference a, OwnerReference b) {
    return Objects.equals(a.getKind(), b.getKind())
        && Objects.equals(a.getName(), b.getName())
        && Objects.equals(apiGroup(a.getApiVersion()), apiGroup(b.getApiVersion()));
  }

  private static String apiGroup(String apiVersion) {
    if (apiVersion == null || !apiVersion.contains("/")) {
      return "";
    }
    return apiVersion.substring(0, apiVersion.indexOf('/'));
  }

  /**
   * Creates the secret, or replaces the data of an existing secret of the same name. Everything
   * else on an existing secret, such as its labels, is left as it is.
   */
  public void createOrUpdateTlsSecret(Secret secret) {
    val name = secret.getMetadata().getName();
    val namespace = secret.getMetadata().getNamespace();

    final Optional<Secret> existing;
    try {
      existing = getSecret(namespace, name);
    } catch (KubernetesClientException e) {
      throw new CertificateOperatorException(
          String.format(ERR_GETTING_SECRET, name, namespace, e.getMessage()), e);
    }

    if (!existing.isPresent()) {
      try {
        client.secrets().inNamespace(namespace).resource(secret).create();
      } catch (KubernetesClientException e) {
        throw new CertificateOperatorException(
            String.format(ERR_CREATING_SECRET, name, namespace, e.getMessage()), e);
      }
      log.info("Inserted secret {} into namespace {}", name, namespace);
      return;
    }

    val updated = existing.get();
    updated.setData(secret.getData());
    try {
      client.secrets().inNamespace(namespace).resource(updated).update();
    } catch (KubernetesClientException e) {
      throw new CertificateOperatorException(
          String.format(ERR_UPDATING_SECRET, name, namespace, e.getMessage()), e);
    }
    log.info("Updated secret {} in namespace {}", name, namespace);
  }
}
