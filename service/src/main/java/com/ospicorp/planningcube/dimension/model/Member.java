package com.ospicorp.planningcube.dimension.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

// Members only point at their parent; children and ancestors are derived by the catalog.
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Member(
    String id,
    @JsonProperty("dimension_id") String dimensionId,
    String name,
    String code,
    @JsonProperty("parent_id") String parentId
) {

  public boolean isRoot() {
    return parentId == null;
  }

  public Member withParent(String newParentId) {
    return new Member(id, dimensionId, name, code, newParentId);
  }

  public Member withNameAndCode(String newName, String newCode) {
    return new Member(id, dimensionId, newName, newCode, parentId);
  }
}
