package io.dana.cert.operator.util;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import java.util.regex.Pattern;

/**
 * Conversions between the timestamp formats of the certificate API and the Kubernetes API.
 */
final public class Timestamps {
  final static private String API_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";
  final static private Pattern API_SHAPE =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}");
  final static private DateTimeFormatter API_FORMAT =
      DateTimeFormat.forPattern(API_PATTERN).withZoneUTC();
  final static private DateTimeFormatter RFC3339_FORMAT =
      DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZoneUTC();
  final static private DateTimeFormatter RFC3339_PARSER =
      ISODateTimeFormat.dateTimeParser().withZoneUTC();

  private Timestamps() {
  }

  /**
   * Parses a certificate API timestamp such as {@code 2024-10-18T09:05:22} as UTC.
   *
   * @throws IllegalArgumentException if the value is not exactly in that shape or out of range
   */
  public static DateTime parseApiTimestamp(String value) {
    if (value == null || !API_SHAPE.matcher(value).matches()) {
      throw new IllegalArgumentException(
          String.format("parsing time \"%s\": expected format %s", value, API_PATTERN));
    }

    try {
      return API_FORMAT.parseDateTime(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("parsing time \"%s\": %s", value, e.getMessage()), e);
    }
  }

  /** Formats an instant the way Kubernetes serializes times, e.g. {@code 2024-10-18T09:05:22Z}. */
  public static String format(DateTime dateTime) {
    return RFC3339_FORMAT.print(dateTime);
  }

  /** Parses a timestamp previously written by {@link #format(DateTime)}. */
  public static DateTime parse(String value) {
    return RFC3339_PARSER.parseDateTime(value);
  }
}
