package com.ospicorp.planningcube.fact.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

// One observed metric value at a cube cell (CubeEntry in the planning UI).
public record Fact(
    String id,
    @JsonProperty("scope_id") String scopeId,
    @JsonProperty("metric_name") String metricName,
    YearMonth period,
    BigDecimal value,
    @JsonProperty("dimensions") Map<DimensionType, String> assignment
) {

  public Fact {
    assignment = FactKey.sortedCopy(assignment);
  }

  @JsonIgnore
  public FactKey key() {
    return new FactKey(scopeId, metricName, period, assignment);
  }

  /** Member assigned along the given axis, or null when the fact is unassigned there. */
  public String memberFor(DimensionType type) {
    return assignment.get(type);
  }

  public Fact withIdAndValue(String newId, BigDecimal newValue) {
    return new Fact(newId, scopeId, metricName, period, newValue, assignment);
  }
}
