package com.ospicorp.planningcube.fact.model;

import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Filtered read over one metric of a scope.
 *
 * @param periods       {@code YYYY-MM} tokens; null or empty means every period
 * @param filters       member per axis; a fact matches a filter when it is assigned to that
 *                      member or to one of its descendants
 * @param groupBy       axes to bucket by; empty returns one row per fact
 * @param groupByPeriod additionally bucket by period
 * @param deadline      optional instant after which the scan is abandoned
 */
public record CubeQuery(
    String scopeId,
    String metricName,
    List<String> periods,
    Map<DimensionType, String> filters,
    List<DimensionType> groupBy,
    boolean groupByPeriod,
    Instant deadline
) {

  public CubeQuery {
    periods = periods == null ? List.of() : List.copyOf(periods);
    filters = FactKey.sortedCopy(filters);
    groupBy = groupBy == null ? List.of() : List.copyOf(new LinkedHashSet<>(groupBy));
  }

  public static Builder builder(String scopeId, String metricName) {
    return new Builder(scopeId, metricName);
  }

  public boolean isGrouped() {
    return !groupBy.isEmpty() || groupByPeriod;
  }

  public static final class Builder {
    private final String scopeId;
    private final String metricName;
    private final List<String> periods = new ArrayList<>();
    private final Map<DimensionType, String> filters = new EnumMap<>(DimensionType.class);
    private final List<DimensionType> groupBy = new ArrayList<>();
    private boolean groupByPeriod;
    private Instant deadline;

    private Builder(String scopeId, String metricName) {
      this.scopeId = scopeId;
      this.metricName = metricName;
    }

    public Builder periods(List<String> values) {
      if (values != null) {
        periods.addAll(values);
      }
      return this;
    }

    public Builder period(String value) {
      periods.add(value);
      return this;
    }

    public Builder filter(DimensionType type, String memberId) {
      filters.put(type, memberId);
      return this;
    }

    public Builder groupBy(DimensionType type) {
      groupBy.add(type);
      return this;
    }

    public Builder groupByPeriod() {
      groupByPeriod = true;
      return this;
    }

    public Builder deadline(Instant value) {
      deadline = value;
      return this;
    }

    public CubeQuery build() {
      return new CubeQuery(scopeId, metricName, periods, filters, groupBy, groupByPeriod,
          deadline);
    }
  }
}
