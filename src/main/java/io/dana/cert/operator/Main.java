package io.dana.cert.operator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;

import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.dana.cert.operator.issuance.IssuanceClientFactory;
import io.dana.cert.operator.issuance.JdkHttpTransport;
import io.dana.cert.operator.kubernetes.CertificateConfigReconciler;
import io.dana.cert.operator.kubernetes.CertificateManager;
import io.dana.cert.operator.kubernetes.CertificateReconciler;
import io.dana.cert.operator.kubernetes.SecretManager;
import io.dana.cert.operator.tls.ArchiveDecoder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.api.config.ControllerConfigurationOverrider;
import io.javaoperatorsdk.operator.processing.retry.GenericRetry;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import static io.dana.cert.operator.util.EnvironmentalConfiguration.loadConfiguration;
import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Run the certificate operator and reconcile Certificate and CertificateConfig objects.
 */
@Slf4j
public class Main {
  final static private Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  public static void main(String[] args) {
    setLogLevel();

    val config = loadConfiguration();
    final KubernetesClient client = new KubernetesClientBuilder().build();
    val certificateManager = new CertificateManager(client);
    val secretManager = new SecretManager(client);
    val certificateReconciler = new CertificateReconciler(
        certificateManager,
        secretManager,
        new IssuanceClientFactory(new JdkHttpTransport()),
        new ArchiveDecoder(),
        Clock.systemUTC(),
        config.getNotFoundRequeueDelay());

    val operator = new Operator(o -> o.withKubernetesClient(client));
    operator.installShutdownHook(SHUTDOWN_TIMEOUT);
    operator.register(certificateReconciler, overrides(config.getWatchNamespaces()));
    operator.register(new CertificateConfigReconciler(certificateManager, secretManager),
        overrides(ImmutableSet.of()));
    operator.start();

    log.info("Certificate operator started, watching {}",
        config.getWatchNamespaces().isEmpty() ? "all namespaces" : config.getWatchNamespaces());
  }

  /**
   * Controller settings shared by both reconcilers. Failed reconciles are retried with
   * exponential backoff until they succeed; an empty namespace set watches the whole cluster.
   */
  @VisibleForTesting
  static <P extends HasMetadata> Consumer<ControllerConfigurationOverrider<P>> overrides(
      Set<String> namespaces) {
    return o -> {
      o.withRetry(retry());
      if (!namespaces.isEmpty()) {
        o.settingNamespaces(namespaces);
      }
    };
  }

  @VisibleForTesting
  static GenericRetry retry() {
    return GenericRetry.defaultLimitedExponentialRetry().withoutMaxAttempts();
  }

  public static void setLogLevel() {
    final Level level = Optional.ofNullable(System.getenv("LOG_LEVEL"))
        .map(Level::valueOf)
        .orElse(Level.INFO);

    final Logger rootLogger = (Logger) LoggerFactory.getLogger(ROOT_LOGGER_NAME);

    rootLogger.setLevel(level);
  }
}
