package io.dana.cert.operator.kubernetes;

import java.time.Duration;

import io.dana.cert.operator.model.CertificateConfig;
import io.dana.cert.operator.model.Constants;
import io.dana.cert.operator.util.CertificateOperatorException;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

/**
 * Guards CertificateConfigs: checks that the credentials secret exists and keeps a config from
 * being deleted while certificates reference it.
 */
@Slf4j
@ControllerConfiguration(name = CertificateConfigReconciler.NAME,
    finalizerName = Constants.DEPENDENCIES_FINALIZER)
public class CertificateConfigReconciler
    implements Reconciler<CertificateConfig>, Cleaner<CertificateConfig> {
  final static String NAME = "certificateconfig";
  final static String ERR_CERTIFICATES_EXIST =
      "cannot delete CertificateConfig because associated Certificates exist";
  final static Duration DELETION_RETRY_DELAY = Duration.ofSeconds(30);

  final private CertificateManager certificateManager;
  final private SecretManager secretManager;

  public CertificateConfigReconciler(CertificateManager certificateManager,
                                     SecretManager secretManager) {
    this.certificateManager = certificateManager;
    this.secretManager = secretManager;
  }

  @Override
  public UpdateControl<CertificateConfig> reconcile(CertificateConfig config,
                                                    Context<CertificateConfig> context) {
    val secretRef = config.getSpec().getSecretRef();
    if (!secretManager.getSecret(secretRef.getNamespace(), secretRef.getName()).isPresent()) {
      throw new CertificateOperatorException(String.format(
          "failed to get secret: secret \"%s\" not found in the namespace \"%s\"",
          secretRef.getName(), secretRef.getNamespace()));
    }

    log.debug("CertificateConfig {} uses credentials from {}/{}",
        config.getMetadata().getName(), secretRef.getNamespace(), secretRef.getName());
    return UpdateControl.noUpdate();
  }

  @Override
  public DeleteControl cleanup(CertificateConfig config, Context<CertificateConfig> context) {
    val name = config.getMetadata().getName();
    log.info("Deletion of CertificateConfig {} requested", name);

    try {
      checkNoDependentCertificates(name);
    } catch (DependentCertificatesException e) {
      log.warn("Keeping CertificateConfig {}: {}", name, e.getMessage());
      return DeleteControl.noFinalizerRemoval().rescheduleAfter(DELETION_RETRY_DELAY);
    }

    log.info("Removing finalizer {} from CertificateConfig {}",
        Constants.DEPENDENCIES_FINALIZER, name);
    return DeleteControl.defaultDelete();
  }

  /**
   * @throws DependentCertificatesException if any certificate in any namespace references the
   *                                        config
   */
  void checkNoDependentCertificates(String configName) {
    val certificates = certificateManager.listCertificatesReferencing(configName);
    if (!certificates.isEmpty()) {
      log.info("Found {} certificates referencing CertificateConfig {}", certificates.size(),
          configName);
      throw new DependentCertificatesException(ERR_CERTIFICATES_EXIST);
    }
  }
}
