package io.dana.cert.operator.util;

import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings in the Kubernetes API form, e.g. {@code 30s}, {@code 2m},
 * {@code 1h30m}, {@code -1.5h} or {@code 300us}. A bare {@code 0} is the only value allowed
 * without a unit.
 */
final public class Durations {
  final static private String NUMBER = "(?:\\d+(?:\\.\\d*)?|\\.\\d+)";
  final static private String UNIT = "(?:ns|us|\u00b5s|\u03bcs|ms|s|m|h)";

  final static private Pattern SEGMENT = Pattern.compile("(" + NUMBER + ")(" + UNIT + ")");
  final static private Pattern WHOLE =
      Pattern.compile("([-+]?)(0|(?:" + NUMBER + UNIT + ")+)");

  final static private Map<String, Long> NANOS_PER_UNIT = ImmutableMap.<String, Long>builder()
      .put("ns", 1L)
      .put("us", 1_000L)
      .put("\u00b5s", 1_000L)
      .put("\u03bcs", 1_000L)
      .put("ms", 1_000_000L)
      .put("s", 1_000_000_000L)
      .put("m", 60_000_000_000L)
      .put("h", 3_600_000_000_000L)
      .build();

  private Durations() {
  }

  public static Duration parse(String value) {
    final Matcher whole = value == null ? null : WHOLE.matcher(value);
    if (whole == null || !whole.matches()) {
      throw new CertificateOperatorException("invalid duration: " + value);
    }

    double nanos = 0;
    final Matcher matcher = SEGMENT.matcher(whole.group(2));
    while (matcher.find()) {
      nanos += Double.parseDouble(matcher.group(1)) * NANOS_PER_UNIT.get(matcher.group(2));
    }

    final Duration duration = Duration.ofNanos(Math.round(nanos));
    return "-".equals(whole.group(1)) ? duration.negated() : duration;
  }
}
