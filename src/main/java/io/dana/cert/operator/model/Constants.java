package io.dana.cert.operator.model;

/**
 * Names and keys shared by the controllers.
 */
final public class Constants {
  final public static String GROUP = "cert.dana.io";
  final public static String VERSION = "v1alpha1";

  final public static String DEPENDENCIES_FINALIZER = GROUP + "/check-dependencies";
  final public static String CONDITION_ERROR = "Error";

  /** Key in the credentials secret holding the JSON credentials bundle. */
  final public static String CREDENTIALS_KEY = "credentials";

  final public static String TLS_CERT_KEY = "tls.crt";
  final public static String TLS_PRIVATE_KEY_KEY = "tls.key";
  final public static String TLS_SECRET_TYPE = "kubernetes.io/tls";

  private Constants() {
  }
}
