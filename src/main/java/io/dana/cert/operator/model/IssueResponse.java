package io.dana.cert.operator.model;

import lombok.Value;

/**
 * Response of the certificate API to a creation request.
 */
@Value
public class IssueResponse {
  String taskId;
}
