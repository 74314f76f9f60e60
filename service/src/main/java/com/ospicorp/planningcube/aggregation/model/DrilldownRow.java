package com.ospicorp.planningcube.aggregation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

// direct == true marks the amount assigned to the drilled member itself rather than a child.
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DrilldownRow(
    @JsonProperty("member_id") String memberId,
    String name,
    String code,
    BigDecimal value,
    BigDecimal percentage,
    @JsonProperty("child_count") int childCount,
    boolean drillable,
    boolean direct
) {}
