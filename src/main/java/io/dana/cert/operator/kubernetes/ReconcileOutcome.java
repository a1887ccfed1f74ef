package io.dana.cert.operator.kubernetes;

import java.time.Duration;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Result of a single reconcile pass over a certificate.
 */
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconcileOutcome {
  final private RuntimeException error;
  final private Duration requeueAfter;

  public static ReconcileOutcome done() {
    return new ReconcileOutcome(null, null);
  }

  public static ReconcileOutcome failed(RuntimeException error) {
    return new ReconcileOutcome(error, null);
  }

  /** A failure that is retried after a fixed delay instead of the default backoff. */
  public static ReconcileOutcome requeue(RuntimeException error, Duration requeueAfter) {
    return new ReconcileOutcome(error, requeueAfter);
  }

  public boolean isDone() {
    return error == null;
  }

  public Optional<RuntimeException> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<Duration> getRequeueAfter() {
    return Optional.ofNullable(requeueAfter);
  }
}
