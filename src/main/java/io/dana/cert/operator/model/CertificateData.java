package io.dana.cert.operator.model;

import lombok.Data;

@Data
public class CertificateData {
  Subject subject = new Subject();
  San san = new San();
  String template;

  /** Archive form to download, e.g. {@code pfx}. */
  String form;
}
