package com.mk.fx.qa.latency.execution.export;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

final class CsvFormat {

  static final CsvMapper MAPPER = new CsvMapper();

  private CsvFormat() {
    throw new UnsupportedOperationException("CsvFormat cannot be instantiated");
  }

  static CsvSchema schemaWithHeader(Class<?> rowType) {
    return MAPPER.schemaFor(rowType).withHeader();
  }

  static double round(double value, int scale) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }

  static Double round(Double value, int scale) {
    return value != null ? round(value.doubleValue(), scale) : null;
  }

  /** {@code HTTP_500=2;READ_TIMEOUT=1}, keys sorted. */
  static String reasons(Map<String, Long> failuresByReason) {
    if (failuresByReason == null || failuresByReason.isEmpty()) {
      return "";
    }
    return new TreeMap<>(failuresByReason)
        .entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(";"));
  }
}
