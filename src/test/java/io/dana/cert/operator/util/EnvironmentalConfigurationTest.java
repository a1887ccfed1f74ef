package io.dana.cert.operator.util;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import java.time.Duration;

import lombok.val;

import static io.dana.cert.operator.util.EnvironmentalConfiguration.loadConfiguration;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class EnvironmentalConfigurationTest {
  @Test
  public void testDefaults() {
    val config = loadConfiguration(ImmutableMap.of());

    assertTrue("All namespaces are watched by default", config.getWatchNamespaces().isEmpty());
    assertEquals(Duration.ofSeconds(5), config.getNotFoundRequeueDelay());
  }

  @Test
  public void testWatchNamespaces() {
    val config = loadConfiguration(ImmutableMap.of("WATCH_NAMESPACES", "default, certs,,"));

    assertEquals(ImmutableSet.of("default", "certs"), config.getWatchNamespaces());
  }

  @Test
  public void testNotFoundRequeueDelay() {
    val config = loadConfiguration(ImmutableMap.of("NOT_FOUND_REQUEUE_SECONDS", "12"));

    assertEquals(Duration.ofSeconds(12), config.getNotFoundRequeueDelay());
  }

  @Test
  public void testInvalidRequeueDelay() {
    assertThrows(CertificateOperatorException.class,
        () -> loadConfiguration(ImmutableMap.of("NOT_FOUND_REQUEUE_SECONDS", "soon")));
  }
}
