package io.dana.cert.operator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Subject alternative names.
 */
@Data
public class San {
  List<String> dns = new ArrayList<>();
  List<String> ips = new ArrayList<>();
}
