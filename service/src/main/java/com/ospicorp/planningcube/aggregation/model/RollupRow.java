package com.ospicorp.planningcube.aggregation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Subtree total of one member. The row with {@code unassigned == true} has no member and
 * carries the facts that are not tagged along the rolled-up dimension.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollupRow(
    @JsonProperty("member_id") String memberId,
    String name,
    String code,
    int level,
    BigDecimal value,
    @JsonProperty("fact_count") int factCount,
    boolean unassigned
) {}
