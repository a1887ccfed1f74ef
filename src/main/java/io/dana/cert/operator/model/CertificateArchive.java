package io.dana.cert.operator.model;

import lombok.Value;

/**
 * A downloaded certificate: a base64 encoded, password protected archive.
 */
@Value
public class CertificateArchive {
  String form;
  String format;
  String data;
  String password;
}
