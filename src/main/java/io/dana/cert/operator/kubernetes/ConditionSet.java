package io.dana.cert.operator.kubernetes;

import com.google.common.collect.ImmutableList;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.dana.cert.operator.util.Timestamps;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import lombok.val;

/**
 * Status conditions keyed by type, so each type occurs at most once.
 *
 * Converted from and to the ordered list of the resource status at the API boundary.
 */
public class ConditionSet {
  final private Map<String, Condition> conditions = new LinkedHashMap<>();
  final private Clock clock;

  private ConditionSet(Clock clock) {
    this.clock = clock;
  }

  public static ConditionSet of(List<Condition> conditions, Clock clock) {
    val set = new ConditionSet(clock);
    if (conditions != null) {
      conditions.forEach(condition -> set.conditions.put(condition.getType(), condition));
    }
    return set;
  }

  /**
   * Adds or replaces the condition of the same type. The transition time only moves when the
   * status changes.
   */
  public void set(Condition condition) {
    val existing = conditions.get(condition.getType());
    val now = Timestamps.format(new DateTime(clock.millis(), DateTimeZone.UTC));

    final String transitionTime;
    if (existing != null && Objects.equals(existing.getStatus(), condition.getStatus())) {
      transitionTime = existing.getLastTransitionTime();
    } else if (condition.getLastTransitionTime() != null) {
      transitionTime = condition.getLastTransitionTime();
    } else {
      transitionTime = now;
    }

    conditions.put(condition.getType(), new ConditionBuilder(condition)
        .withLastTransitionTime(transitionTime)
        .build());
  }

  /** Removes the condition of the given type. Returns whether there was one. */
  public boolean remove(String type) {
    return conditions.remove(type) != null;
  }

  Optional<Condition> find(String type) {
    return Optional.ofNullable(conditions.get(type));
  }

  public List<Condition> toList() {
    return ImmutableList.copyOf(conditions.values());
  }
}
