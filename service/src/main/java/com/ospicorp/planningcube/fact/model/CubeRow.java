package com.ospicorp.planningcube.fact.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

/**
 * One row of a cube query. Ungrouped queries yield a row per fact ({@code count == 1}) that
 * carries {@code factId} and no group key; grouped queries yield a row per bucket, where a
 * null member in {@code dimensions} marks the unassigned bucket of that axis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CubeRow(
    @JsonProperty("group_key") String groupKey,
    @JsonProperty("fact_id") String factId,
    Map<DimensionType, String> dimensions,
    YearMonth period,
    @JsonProperty("total_value") BigDecimal totalValue,
    int count,
    BigDecimal average
) {}
