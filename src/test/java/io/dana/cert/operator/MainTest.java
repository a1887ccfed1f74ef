package io.dana.cert.operator;

import com.google.common.collect.ImmutableSet;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.CertificateConfig;
import io.javaoperatorsdk.operator.api.config.ControllerConfigurationOverrider;
import io.javaoperatorsdk.operator.processing.retry.GenericRetry;
import io.javaoperatorsdk.operator.processing.retry.Retry;
import lombok.val;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@RunWith(MockitoJUnitRunner.class)
public class MainTest {
  @Mock
  private ControllerConfigurationOverrider<Certificate> certificateOverrider;

  @Mock
  private ControllerConfigurationOverrider<CertificateConfig> configOverrider;

  @Captor
  private ArgumentCaptor<Retry> retry;

  @Test
  public void testCertificateControllerRetriesAndWatchesNamespaces() {
    Main.<Certificate>overrides(ImmutableSet.of("default", "web")).accept(certificateOverrider);

    verify(certificateOverrider).withRetry(retry.capture());
    verify(certificateOverrider).settingNamespaces(ImmutableSet.of("default", "web"));
    assertRetriesForever(retry.getValue());
  }

  @Test
  public void testConfigControllerRetriesClusterWide() {
    Main.<CertificateConfig>overrides(ImmutableSet.of()).accept(configOverrider);

    verify(configOverrider).withRetry(retry.capture());
    verify(configOverrider, never()).settingNamespaces(anySet());
    assertRetriesForever(retry.getValue());
  }

  @Test
  public void testRetryHasNoAttemptLimit() {
    val policy = Main.retry();

    assertEquals(-1, policy.getMaxAttempts());
  }

  private static void assertRetriesForever(Retry retry) {
    val execution = retry.initExecution();
    for (int attempt = 0; attempt < 100; attempt++) {
      assertTrue("retry stopped after " + attempt + " attempts",
          execution.nextDelay().isPresent());
    }
  }
}
