package com.ospicorp.planningcube.fact.model;

import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.time.YearMonth;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Natural key of a fact. Two writes with equal keys address the same cell of the cube.
 */
public record FactKey(
    String scopeId,
    String metricName,
    YearMonth period,
    Map<DimensionType, String> assignment
) {

  public FactKey {
    assignment = sortedCopy(assignment);
  }

  /**
   * Stable textual form, {@code scope|metric|2025-01|DEPARTMENT=id;REGION=id}, used as the
   * unique column by database-backed repositories. Delimiters and backslashes inside scope,
   * metric or member ids are backslash-escaped, so distinct keys never share a form.
   */
  public String canonical() {
    StringBuilder builder = new StringBuilder();
    escape(builder, scopeId).append('|');
    escape(builder, metricName).append('|');
    builder.append(period).append('|');
    boolean first = true;
    for (Map.Entry<DimensionType, String> entry : assignment.entrySet()) {
      if (!first) {
        builder.append(';');
      }
      builder.append(entry.getKey().name()).append('=');
      escape(builder, entry.getValue());
      first = false;
    }
    return builder.toString();
  }

  private static StringBuilder escape(StringBuilder builder, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\\' || c == '|' || c == ';' || c == '=') {
        builder.append('\\');
      }
      builder.append(c);
    }
    return builder;
  }

  static Map<DimensionType, String> sortedCopy(Map<DimensionType, String> source) {
    EnumMap<DimensionType, String> sorted = new EnumMap<>(DimensionType.class);
    if (source != null) {
      sorted.putAll(source);
    }
    return Collections.unmodifiableMap(sorted);
  }
}
