package io.dana.cert.operator.model;

import lombok.Data;

@Data
public class Subject {
  String commonName;
  String country;
  String state;
  String locality;
  String organization;
  String organizationUnit;
}
