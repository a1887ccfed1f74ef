package io.dana.cert.operator.kubernetes;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import io.dana.cert.operator.issuance.IssuanceClient;
import io.dana.cert.operator.issuance.IssuanceClientFactory;
import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.CertificateArchive;
import io.dana.cert.operator.model.CertificateConfig;
import io.dana.cert.operator.model.CertificateStatus;
import io.dana.cert.operator.model.CertificateValidity;
import io.dana.cert.operator.model.ConditionReason;
import io.dana.cert.operator.model.TlsMaterial;
import io.dana.cert.operator.tls.ArchiveDecoder;
import io.dana.cert.operator.util.CertificateOperatorException;
import io.dana.cert.operator.util.Timestamps;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.javaoperatorsdk.operator.api.config.informer.InformerEventSourceConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import io.javaoperatorsdk.operator.processing.event.source.informer.InformerEventSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import static io.dana.cert.operator.model.Constants.CONDITION_ERROR;
import static io.dana.cert.operator.model.Constants.GROUP;

/**
 * Reconciles {@link Certificate} resources: decides whether a certificate has to be (re)issued,
 * drives the certificate API through issue, validity and download, and stores the result as a
 * TLS secret owned by the certificate.
 *
 * Every failure is recorded as the single {@code Error} condition of the certificate before it
 * is handed back to the operator runtime for a retry.
 */
@Slf4j
@ControllerConfiguration(name = CertificateReconciler.NAME)
public class CertificateReconciler implements Reconciler<Certificate> {
  final static String NAME = "certificate";
  final static String SECRET_EVENT_SOURCE_NAME = "tls-secrets";

  /** HTTP reason phrase of a certificate the API does not know yet. */
  final static String NOT_FOUND = "Not Found";

  final static String ERR_CREATION_FAILED = "failed to create Certificate: ";
  final static String ERR_UPDATE_STATUS = "failed to update Certificate status: ";
  final static String ERR_GET_SECRET = "failed to get secret: ";
  final static String ERR_BUILD_CLIENT = "failed to build Cert client: ";
  final static String ERR_PARSE_VALID_TO = "failed to parse validTo: ";
  final static String ERR_PARSE_VALID_FROM = "failed to parse validFrom: ";
  final static String ERR_DOWNLOAD = "failed downloading certificate: ";
  final static String ERR_SET_OWNER_REFERENCE = "failed to set owner reference for secret ";
  final static String ERR_CREATE_OR_UPDATE_SECRET = "failed to create or update tls secret: ";
  final static String ERR_CHECK_SECRET = "failed to check secret: ";

  final private CertificateManager certificateManager;
  final private SecretManager secretManager;
  final private IssuanceClientFactory clientFactory;
  final private ArchiveDecoder decoder;
  final private Clock clock;

  @Getter
  final private Duration notFoundRequeueDelay;

  public CertificateReconciler(CertificateManager certificateManager,
                               SecretManager secretManager,
                               IssuanceClientFactory clientFactory,
                               ArchiveDecoder decoder,
                               Clock clock,
                               Duration notFoundRequeueDelay) {
    this.certificateManager = certificateManager;
    this.secretManager = secretManager;
    this.clientFactory = clientFactory;
    this.decoder = decoder;
    this.clock = clock;
    this.notFoundRequeueDelay = notFoundRequeueDelay;
  }

  /**
   * Failure of a pipeline step. The condition message is the text of the underlying error, the
   * exception message carries the step's prefix.
   */
  @Getter
  static class StepException extends CertificateOperatorException {
    final private ConditionReason reason;
    final private String conditionMessage;

    StepException(ConditionReason reason, String prefix, RuntimeException cause) {
      super(prefix + cause.getMessage(), cause);
      this.reason = reason;
      this.conditionMessage = cause.getMessage();
    }
  }

  @Override
  public UpdateControl<Certificate> reconcile(Certificate certificate,
                                              Context<Certificate> context) {
    val outcome = reconcileCertificate(certificate);

    if (outcome.getRequeueAfter().isPresent()) {
      log.warn("Certificate {} is not available yet, retrying in {}: {}",
          name(certificate), outcome.getRequeueAfter().get(),
          outcome.getError().map(Throwable::getMessage).orElse(""));
      return UpdateControl.<Certificate>noUpdate()
          .rescheduleAfter(outcome.getRequeueAfter().get());
    }

    if (outcome.getError().isPresent()) {
      throw outcome.getError().get();
    }

    return UpdateControl.noUpdate();
  }

  /** Watches the TLS secrets owned by certificates so a deleted secret gets recreated. */
  @Override
  public List<EventSource<?, Certificate>> prepareEventSources(
      EventSourceContext<Certificate> context) {
    InformerEventSourceConfiguration<Secret> configuration = InformerEventSourceConfiguration
        .from(Secret.class, Certificate.class)
        .withName(SECRET_EVENT_SOURCE_NAME)
        .withSecondaryToPrimaryMapper(CertificateReconciler::owningCertificates)
        .build();

    return List.of(new InformerEventSource<>(configuration, context));
  }

  @VisibleForTesting
  static Set<ResourceID> owningCertificates(Secret secret) {
    val references = secret.getMetadata().getOwnerReferences();
    if (references == null) {
      return Set.of();
    }

    val kind = HasMetadata.getKind(Certificate.class);
    val apiVersion = HasMetadata.getApiVersion(Certificate.class);
    return references.stream()
        .filter(reference -> kind.equals(reference.getKind())
            && apiVersion.equals(reference.getApiVersion()))
        .map(reference ->
            new ResourceID(reference.getName(), secret.getMetadata().getNamespace()))
        .collect(Collectors.toSet());
  }

  /**
   * Runs one reconcile pass over the certificate. The certificate's status is modified and
   * persisted along the way.
   */
  public ReconcileOutcome reconcileCertificate(Certificate certificate) {
    log.info("Reconciling certificate {}", name(certificate));
    if (certificate.getStatus() == null) {
      certificate.setStatus(new CertificateStatus());
    }
    val namespace = certificate.getMetadata().getNamespace();

    final CertificateConfig config;
    try {
      config = loadConfig(certificate);
    } catch (KubernetesClientException | CertificateOperatorException e) {
      return recordFailure(certificate, new StepException(
          ConditionReason.ConfigRetrievalFailed, ERR_CREATION_FAILED, e), null);
    }

    final IssuanceClient client;
    try {
      client = buildClient(config);
    } catch (KubernetesClientException | CertificateOperatorException e) {
      log.error("Cannot build certificate API client for {}: {}", name(certificate),
          e.getMessage());
      return ReconcileOutcome.failed(e);
    }

    try {
      if (isCertificateValid(certificate, config, now())) {
        removeErrorCondition(certificate);
        if (config.getSpec().isForceExpirationUpdate()) {
          forceExpirationUpdate(client, certificate);
        }

        if (isSecretUpToDate(certificate, namespace)) {
          log.debug("Certificate {} is up to date", name(certificate));
          return ReconcileOutcome.done();
        }
      }
    } catch (StatusUpdateException e) {
      return ReconcileOutcome.failed(e);
    } catch (KubernetesClientException e) {
      return ReconcileOutcome.failed(new CertificateOperatorException(
          ERR_CHECK_SECRET + e.getMessage(), e));
    }

    try {
      issueCertificate(client, certificate);
    } catch (StepException e) {
      return recordFailure(certificate, e, null);
    }

    try {
      updateCertificateValidity(client, certificate);
    } catch (StepException e) {
      val delay = e.getMessage().contains(NOT_FOUND) ? notFoundRequeueDelay : null;
      return recordFailure(certificate, e, delay);
    }

    try {
      val material = downloadCertificate(client, certificate);
      storeCertificate(certificate, material, namespace);
    } catch (StepException e) {
      return recordFailure(certificate, e, null);
    }

    try {
      removeErrorCondition(certificate);
    } catch (StatusUpdateException e) {
      return ReconcileOutcome.failed(e);
    }

    log.info("Certificate {} stored in secret {}/{}", name(certificate), namespace,
        certificate.getSpec().getSecretName());
    return ReconcileOutcome.done();
  }

  private CertificateConfig loadConfig(Certificate certificate) {
    val configName = certificate.getSpec().getConfigRef() == null
        ? null : certificate.getSpec().getConfigRef().getName();
    if (Strings.isNullOrEmpty(configName)) {
      throw new CertificateOperatorException("certificate has no configRef");
    }

    return certificateManager.getCertificateConfig(configName)
        .orElseThrow(() -> new CertificateOperatorException(String.format(
            "certificateconfigs.%s \"%s\" not found", GROUP, configName)));
  }

  private IssuanceClient buildClient(CertificateConfig config) {
    val secretRef = config.getSpec().getSecretRef();
    val secret = secretManager.getSecret(secretRef.getNamespace(), secretRef.getName())
        .orElseThrow(() -> new CertificateOperatorException(String.format(
            "%ssecret \"%s\" not found in the namespace \"%s\"", ERR_GET_SECRET,
            secretRef.getName(), secretRef.getNamespace())));

    try {
      return clientFactory.create(config, secret.getData());
    } catch (CertificateOperatorException e) {
      throw new CertificateOperatorException(ERR_BUILD_CLIENT + e.getMessage(), e);
    }
  }

  /**
   * A certificate counts as valid while its recorded expiry lies after now minus the renewal
   * window.
   */
  @VisibleForTesting
  static boolean isCertificateValid(Certificate certificate, CertificateConfig config,
                                    DateTime now) {
    val validTo = certificate.getStatus().getValidTo();
    if (Strings.isNullOrEmpty(validTo)) {
      return false;
    }

    final DateTime expiry;
    try {
      expiry = Timestamps.parse(validTo);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring unparseable validTo {}: {}", validTo, e.getMessage());
      return false;
    }

    val renewDate = now.minusDays(config.getSpec().getDaysBeforeRenewal());
    return expiry.isAfter(renewDate);
  }

  /**
   * The secret is up to date when its name did not change and the recorded secret still
   * exists.
   */
  private boolean isSecretUpToDate(Certificate certificate, String namespace) {
    val desired = certificate.getSpec().getSecretName();
    val recorded = certificate.getStatus().getSecretName();
    if (!Objects.equals(desired, recorded)) {
      log.info("Secret name of certificate {} changed from {} to {}", name(certificate),
          recorded, desired);
      return false;
    }

    if (!certificateManager.secretExists(namespace, recorded)) {
      log.info("Secret {}/{} of certificate {} is gone", namespace, recorded, name(certificate));
      return false;
    }

    return true;
  }

  private void forceExpirationUpdate(IssuanceClient client, Certificate certificate) {
    try {
      updateCertificateValidity(client, certificate);
    } catch (StepException e) {
      log.warn("Forced validity update of {} failed: {}", name(certificate), e.getMessage());
      setErrorCondition(certificate, e.getReason(), e.getConditionMessage());
    }
  }

  /**
   * Requests a new certificate and records its task id. Skipped while the API has not yet
   * caught up with the previous request, in which case the recorded task id is used.
   */
  private void issueCertificate(IssuanceClient client, Certificate certificate) {
    if (hasNotFoundErrorCondition(certificate)) {
      log.info("Not issuing certificate {} again, waiting for task {}", name(certificate),
          certificate.getStatus().getGuid());
      return;
    }

    final String guid;
    try {
      guid = client.issue(certificate);
    } catch (RuntimeException e) {
      throw new StepException(ConditionReason.PostToCertAPIFailed, ERR_CREATION_FAILED, e);
    }

    log.info("Issued certificate {} as task {}", name(certificate), guid);
    certificate.getStatus().setGuid(guid);
    persistStatus(certificate, ERR_CREATION_FAILED);
  }

  private boolean hasNotFoundErrorCondition(Certificate certificate) {
    return ConditionSet.of(certificate.getStatus().getConditions(), clock)
        .find(CONDITION_ERROR)
        .map(Condition::getMessage)
        .filter(message -> message.contains(NOT_FOUND))
        .isPresent();
  }

  private void updateCertificateValidity(IssuanceClient client, Certificate certificate) {
    final CertificateValidity validity;
    try {
      validity = client.fetchValidity(certificate);
    } catch (RuntimeException e) {
      throw new StepException(ConditionReason.GetCertDataFromCertAPIFailed, "", e);
    }

    final DateTime validTo;
    try {
      validTo = parseValidity(validity.getValidTo());
    } catch (ValidityParseException e) {
      throw new StepException(ConditionReason.ParseValidToFailed, ERR_PARSE_VALID_TO, e);
    }

    final DateTime validFrom;
    try {
      validFrom = parseValidity(validity.getValidFrom());
    } catch (ValidityParseException e) {
      throw new StepException(ConditionReason.ParseValidFromFailed, ERR_PARSE_VALID_FROM, e);
    }

    val status = certificate.getStatus();
    status.setValidTo(Timestamps.format(validTo));
    status.setValidFrom(Timestamps.format(validFrom));
    status.setSignatureHashAlgorithm(validity.getSignatureHashAlgorithm());
    persistStatus(certificate, ERR_UPDATE_STATUS);
  }

  @VisibleForTesting
  static DateTime parseValidity(String value) {
    try {
      return Timestamps.parseApiTimestamp(value);
    } catch (IllegalArgumentException e) {
      throw new ValidityParseException(e.getMessage(), e);
    }
  }

  private TlsMaterial downloadCertificate(IssuanceClient client, Certificate certificate) {
    final CertificateArchive archive;
    try {
      archive = client.download(certificate);
    } catch (RuntimeException e) {
      throw new StepException(ConditionReason.DownloadCertFromCertAPIFailed, ERR_DOWNLOAD, e);
    }

    try {
      return decoder.decode(archive.getData(), archive.getPassword());
    } catch (RuntimeException e) {
      throw new StepException(ConditionReason.DecodeCertFailed, ERR_DOWNLOAD, e);
    }
  }

  private void storeCertificate(Certificate certificate, TlsMaterial material, String namespace) {
    val secret = SecretManager.tlsSecret(material, certificate, namespace);

    try {
      SecretManager.setOwnerReference(certificate, secret);
    } catch (OwnerReferenceException e) {
      throw new StepException(ConditionReason.SetOwnerRefFailed,
          ERR_SET_OWNER_REFERENCE + secret.getMetadata().getName() + ": ", e);
    }

    try {
      secretManager.createOrUpdateTlsSecret(secret);
    } catch (KubernetesClientException | CertificateOperatorException e) {
      throw new StepException(ConditionReason.CreateOrUpdateTLSSecretFailed,
          ERR_CREATE_OR_UPDATE_SECRET, e);
    }

    certificate.getStatus().setSecretName(certificate.getSpec().getSecretName());
    persistStatus(certificate, ERR_UPDATE_STATUS);
  }

  private void persistStatus(Certificate certificate, String prefix) {
    try {
      certificateManager.updateStatus(certificate);
    } catch (KubernetesClientException e) {
      throw new StepException(ConditionReason.StatusUpdateFailed, prefix, e);
    }
  }

  /**
   * Records the failure on the certificate. If the condition cannot be written, that error is
   * returned instead of the failure itself.
   */
  private ReconcileOutcome recordFailure(Certificate certificate, StepException failure,
                                         Duration requeueAfter) {
    log.error("Reconciling certificate {} failed with {}: {}", name(certificate),
        failure.getReason(), failure.getMessage());
    try {
      setErrorCondition(certificate, failure.getReason(), failure.getConditionMessage());
    } catch (StatusUpdateException e) {
      return ReconcileOutcome.failed(e);
    }

    return requeueAfter == null
        ? ReconcileOutcome.failed(failure)
        : ReconcileOutcome.requeue(failure, requeueAfter);
  }

  private void setErrorCondition(Certificate certificate, ConditionReason reason,
                                 String message) {
    val conditions = ConditionSet.of(certificate.getStatus().getConditions(), clock);
    conditions.set(errorCondition(certificate, reason, message));
    certificate.getStatus().setConditions(conditions.toList());
    writeConditions(certificate);
  }

  private void removeErrorCondition(Certificate certificate) {
    val conditions = ConditionSet.of(certificate.getStatus().getConditions(), clock);
    if (!conditions.remove(CONDITION_ERROR)) {
      return;
    }

    certificate.getStatus().setConditions(conditions.toList());
    writeConditions(certificate);
  }

  private void writeConditions(Certificate certificate) {
    try {
      certificateManager.updateStatus(certificate);
    } catch (KubernetesClientException e) {
      throw new StatusUpdateException(ERR_UPDATE_STATUS + e.getMessage(), e);
    }
  }

  private static Condition errorCondition(Certificate certificate, ConditionReason reason,
                                          String message) {
    return new ConditionBuilder()
        .withType(CONDITION_ERROR)
        .withStatus("True")
        .withReason(reason.name())
        .withMessage(message)
        .withObservedGeneration(certificate.getMetadata().getGeneration())
        .build();
  }

  private DateTime now() {
    return new DateTime(clock.millis(), DateTimeZone.UTC);
  }

  private static String name(Certificate certificate) {
    return certificate.getMetadata().getNamespace() + "/" + certificate.getMetadata().getName();
  }
}
