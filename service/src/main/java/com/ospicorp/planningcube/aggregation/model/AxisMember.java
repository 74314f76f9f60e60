package com.ospicorp.planningcube.aggregation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AxisMember(String id, String name, String code, int level) {}
