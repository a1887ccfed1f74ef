package io.dana.cert.operator.model;

/**
 * Reasons recorded on the {@code Error} condition of a certificate.
 */
public enum ConditionReason {
  ConfigRetrievalFailed,
  PostToCertAPIFailed,
  GetCertDataFromCertAPIFailed,
  StatusUpdateFailed,
  ParseValidToFailed,
  ParseValidFromFailed,
  SetOwnerRefFailed,
  DownloadCertFromCertAPIFailed,
  DecodeCertFailed,
  CreateOrUpdateTLSSecretFailed
}
