package io.dana.cert.operator.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Body of a certificate creation request sent to the certificate API.
 */
@Value
@Builder
public class CertificateRequest {
  Subject subject;
  San san;
  String template;

  @Value
  @Builder
  public static class Subject {
    String commonName;
    String country;
    String state;
    String locality;
    String organization;
    String organizationalUnit;
  }

  @Value
  @Builder
  public static class San {
    List<String> dns;
    List<String> ips;
  }

  /** Derives the request from the desired state of a certificate. */
  public static CertificateRequest from(CertificateData data) {
    final io.dana.cert.operator.model.Subject subject = data.getSubject();
    final io.dana.cert.operator.model.San san = data.getSan();

    return CertificateRequest.builder()
        .subject(Subject.builder()
            .commonName(subject.getCommonName())
            .country(subject.getCountry())
            .state(subject.getState())
            .locality(subject.getLocality())
            .organization(subject.getOrganization())
            .organizationalUnit(subject.getOrganizationUnit())
            .build())
        .san(San.builder()
            .dns(san.getDns())
            .ips(san.getIps())
            .build())
        .template(data.getTemplate())
        .build();
  }
}
