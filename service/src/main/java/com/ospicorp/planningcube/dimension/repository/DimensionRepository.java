package com.ospicorp.planningcube.dimension.repository;

import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.Member;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for dimensions and their members. Implementations only store and
 * fetch records by key; hierarchy rules are enforced by the catalog.
 */
public interface DimensionRepository {

  Optional<Dimension> findDimension(String dimensionId);

  Optional<Dimension> findDimension(String scopeId, DimensionType type);

  /** Dimensions of a scope ordered by display order. */
  List<Dimension> findDimensions(String scopeId);

  /**
   * Stores the dimension unless one of the same type already exists in the scope, and returns
   * whichever dimension is stored afterwards.
   */
  Dimension insertDimensionIfAbsent(Dimension dimension);

  Optional<Member> findMember(String memberId);

  /** Members of a dimension in insertion order. */
  List<Member> findMembers(String dimensionId);

  void insertMember(Member member);

  void updateMember(Member member);

  boolean deleteMember(String memberId);
}
