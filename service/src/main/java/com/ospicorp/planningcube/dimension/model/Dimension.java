package com.ospicorp.planningcube.dimension.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;

public record Dimension(
    String id,
    @JsonProperty("scope_id") String scopeId,
    DimensionType type,
    String name,
    @JsonProperty("display_order") int displayOrder
) {}
