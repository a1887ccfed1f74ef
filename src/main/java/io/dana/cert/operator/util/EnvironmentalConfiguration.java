package io.dana.cert.operator.util;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import lombok.Value;
import lombok.val;

/**
 * Retrieve all relevant operator configuration from the environment.
 */
public class EnvironmentalConfiguration {
  final static private long DEFAULT_NOT_FOUND_REQUEUE_SECONDS = 5;

  @Value
  public static class Configuration {
    /** Namespaces to watch for certificates. Empty means all namespaces. */
    Set<String> watchNamespaces;

    /** Delay before retrying a certificate the API does not know about yet. */
    Duration notFoundRequeueDelay;
  }

  public static Configuration loadConfiguration() {
    return loadConfiguration(System.getenv());
  }

  public static Configuration loadConfiguration(Map<String, String> environment) {
    val watchNamespaces = getWatchNamespaces(environment);
    val requeueSeconds = environment.get("NOT_FOUND_REQUEUE_SECONDS");
    val notFoundRequeueDelay = requeueSeconds == null
        ? Duration.ofSeconds(DEFAULT_NOT_FOUND_REQUEUE_SECONDS)
        : Duration.ofSeconds(parseSeconds(requeueSeconds));

    return new Configuration(watchNamespaces, notFoundRequeueDelay);
  }

  private static Set<String> getWatchNamespaces(Map<String, String> environment) {
    val namespaces = environment.getOrDefault("WATCH_NAMESPACES", "");
    return ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(namespaces));
  }

  private static long parseSeconds(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new CertificateOperatorException(
          "NOT_FOUND_REQUEUE_SECONDS must be a number of seconds: " + value, e);
    }
  }
}
