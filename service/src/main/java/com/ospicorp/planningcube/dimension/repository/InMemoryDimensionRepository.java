package com.ospicorp.planningcube.dimension.repository;

import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.Member;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "planning.cube.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryDimensionRepository implements DimensionRepository {
  private final Map<String, Dimension> dimensions = new ConcurrentHashMap<>();
  private final Map<ScopeType, String> dimensionsByType = new ConcurrentHashMap<>();
  private final Map<String, Member> members = new ConcurrentHashMap<>();
  private final Map<String, Map<String, Boolean>> membersByDimension = new ConcurrentHashMap<>();

  @Override
  public Optional<Dimension> findDimension(String dimensionId) {
    return Optional.ofNullable(dimensions.get(dimensionId));
  }

  @Override
  public Optional<Dimension> findDimension(String scopeId, DimensionType type) {
    String id = dimensionsByType.get(new ScopeType(scopeId, type));
    return id == null ? Optional.empty() : findDimension(id);
  }

  @Override
  public List<Dimension> findDimensions(String scopeId) {
    List<Dimension> out = new ArrayList<>();
    for (Dimension dimension : dimensions.values()) {
      if (dimension.scopeId().equals(scopeId)) {
        out.add(dimension);
      }
    }
    out.sort(Comparator.comparingInt(Dimension::displayOrder));
    return out;
  }

  @Override
  public Dimension insertDimensionIfAbsent(Dimension dimension) {
    String id = dimensionsByType.computeIfAbsent(
        new ScopeType(dimension.scopeId(), dimension.type()),
        key -> {
          dimensions.put(dimension.id(), dimension);
          membersByDimension.put(dimension.id(), linkedSet());
          return dimension.id();
        });
    return dimensions.get(id);
  }

  @Override
  public Optional<Member> findMember(String memberId) {
    return Optional.ofNullable(members.get(memberId));
  }

  @Override
  public List<Member> findMembers(String dimensionId) {
    Map<String, Boolean> ids = membersByDimension.get(dimensionId);
    if (ids == null) {
      return List.of();
    }
    List<Member> out = new ArrayList<>(ids.size());
    synchronized (ids) {
      for (String id : ids.keySet()) {
        Member member = members.get(id);
        if (member != null) {
          out.add(member);
        }
      }
    }
    return out;
  }

  @Override
  public void insertMember(Member member) {
    Map<String, Boolean> ids = membersByDimension.computeIfAbsent(member.dimensionId(),
        key -> linkedSet());
    members.put(member.id(), member);
    synchronized (ids) {
      ids.put(member.id(), Boolean.TRUE);
    }
  }

  @Override
  public void updateMember(Member member) {
    members.replace(member.id(), member);
  }

  @Override
  public boolean deleteMember(String memberId) {
    Member removed = members.remove(memberId);
    if (removed == null) {
      return false;
    }
    Map<String, Boolean> ids = membersByDimension.get(removed.dimensionId());
    if (ids != null) {
      synchronized (ids) {
        ids.remove(memberId);
      }
    }
    return true;
  }

  // Insertion-ordered key set; callers synchronize on the map itself.
  private static Map<String, Boolean> linkedSet() {
    return new LinkedHashMap<>();
  }

  private record ScopeType(String scopeId, DimensionType type) {}
}
