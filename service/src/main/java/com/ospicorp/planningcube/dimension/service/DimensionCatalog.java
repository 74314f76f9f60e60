package com.ospicorp.planningcube.dimension.service;

import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.Member;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import com.ospicorp.planningcube.dimension.repository.DimensionRepository;
import com.ospicorp.planningcube.error.ConflictException;
import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.NotFoundException;
import com.ospicorp.planningcube.error.ValidationException;
import com.ospicorp.planningcube.fact.repository.FactRepository;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class DimensionCatalog {
  private static final Logger log = LoggerFactory.getLogger(DimensionCatalog.class);
  static final String ROOT_CODE = "ALL";

  private final DimensionRepository repository;
  private final FactRepository factRepository;
  private final DefaultDimensionSeed seed;
  private final Map<String, DimensionHierarchy> hierarchies = new ConcurrentHashMap<>();

  public DimensionCatalog(DimensionRepository repository, FactRepository factRepository,
      DefaultDimensionSeed seed) {
    this.repository = repository;
    this.factRepository = factRepository;
    this.seed = seed;
  }

  public List<Dimension> initialize(String scopeId) {
    requireScope(scopeId);
    log.info("Applying dimension seed v{} to scope {}", seed.version(), scopeId);
    List<Dimension> out = new ArrayList<>(seed.dimensions().size());
    int order = 0;
    for (DimensionType type : seed.dimensions()) {
      out.add(provision(scopeId, type, order++));
    }
    return out;
  }

  /** Provisions one more dimension type in the scope; returns the existing one if present. */
  public Dimension addDimension(String scopeId, DimensionType type) {
    requireScope(scopeId);
    if (type == null) {
      throw new ValidationException("Dimension type must be provided", ErrorCodes.MISSING_FIELD);
    }
    int nextOrder = 0;
    for (Dimension existing : repository.findDimensions(scopeId)) {
      nextOrder = Math.max(nextOrder, existing.displayOrder() + 1);
    }
    return provision(scopeId, type, nextOrder);
  }

  public List<Dimension> listDimensions(String scopeId) {
    requireScope(scopeId);
    return repository.findDimensions(scopeId);
  }

  public Dimension getDimension(String dimensionId) {
    return repository.findDimension(dimensionId)
        .orElseThrow(() -> new NotFoundException("Dimension not found: " + dimensionId,
            ErrorCodes.UNKNOWN_DIMENSION));
  }

  public Dimension getDimension(String scopeId, DimensionType type) {
    return repository.findDimension(scopeId, type)
        .orElseThrow(() -> new NotFoundException(
            "Dimension " + type.label() + " is not provisioned in scope " + scopeId,
            ErrorCodes.UNKNOWN_DIMENSION));
  }

  /** Members of the dimension in hierarchy order. */
  public List<Member> listMembers(String dimensionId) {
    getDimension(dimensionId);
    return view(dimensionId).preOrder();
  }

  public Member getMember(String memberId) {
    if (!StringUtils.hasText(memberId)) {
      throw new ValidationException("memberId must be provided", ErrorCodes.MISSING_FIELD);
    }
    return repository.findMember(memberId)
        .orElseThrow(() -> new NotFoundException("Member not found: " + memberId,
            ErrorCodes.UNKNOWN_MEMBER));
  }

  /** Depth of the member below its root; roots are level 0. */
  public int level(String memberId) {
    Member member = getMember(memberId);
    return view(member.dimensionId()).depth(memberId);
  }

  public HierarchyView view(String dimensionId) {
    DimensionHierarchy hierarchy = hierarchies.get(dimensionId);
    if (hierarchy == null) {
      hierarchy = hierarchy(getDimension(dimensionId).id());
    }
    return hierarchy.view();
  }

  /**
   * Checks that every assigned member belongs to its dimension in the scope, then runs
   * {@code action} while those dimensions stay read-locked. Structural changes to them, member
   * removal in particular, wait until the action returns.
   */
  public <T> T withMembersPinned(String scopeId, Map<DimensionType, String> assignment,
      Supplier<T> action) {
    requireScope(scopeId);
    Map<DimensionType, String> ordered = new EnumMap<>(DimensionType.class);
    ordered.putAll(assignment);
    Deque<DimensionHierarchy> locked = new ArrayDeque<>(ordered.size());
    try {
      // EnumMap order keeps lock acquisition consistent across callers
      for (Map.Entry<DimensionType, String> entry : ordered.entrySet()) {
        Dimension dimension = getDimension(scopeId, entry.getKey());
        DimensionHierarchy hierarchy = hierarchy(dimension.id());
        hierarchy.lockRead();
        locked.push(hierarchy);
        if (hierarchy.member(entry.getValue()) == null) {
          throw new NotFoundException("Member " + entry.getValue() + " is not part of dimension "
              + dimension.name() + " in scope " + scopeId, ErrorCodes.UNKNOWN_MEMBER);
        }
      }
      return action.get();
    } finally {
      while (!locked.isEmpty()) {
        locked.pop().unlockRead();
      }
    }
  }

  public Member addMember(String dimensionId, String name, String code, String parentId) {
    if (!StringUtils.hasText(name)) {
      throw new ValidationException("Member name is required", ErrorCodes.MISSING_FIELD);
    }
    Dimension dimension = getDimension(dimensionId);
    String memberName = name.trim();
    String memberCode = normalizeCode(code);
    DimensionHierarchy hierarchy = hierarchy(dimension.id());

    return hierarchy.mutate(() -> {
      Member sameName = hierarchy.findByName(memberName);
      if (sameName != null) {
        if (Objects.equals(sameName.code(), memberCode)
            && Objects.equals(sameName.parentId(), parentId)) {
          return sameName;
        }
        throw new ConflictException("Member '" + memberName + "' already exists in dimension "
            + dimension.name(), ErrorCodes.DUPLICATE_NAME);
      }
      requireUniqueCode(hierarchy, dimension, memberCode, null);
      if (parentId != null) {
        requireParentInDimension(hierarchy, dimension, parentId);
      }

      String id = newId();
      if (parentId != null && hierarchy.wouldCreateCycle(id, parentId)) {
        log.warn("Rejected member {} under parent {}: cycle in dimension {}", memberName,
            parentId, dimension.id());
        throw new ValidationException("Parent " + parentId + " would create a cycle",
            ErrorCodes.HIERARCHY_CYCLE);
      }

      Member member = new Member(id, dimension.id(), memberName, memberCode, parentId);
      repository.insertMember(member);
      hierarchy.add(member);
      log.debug("Added member {} ({}) to dimension {} under {}", member.id(), memberName,
          dimension.id(), parentId);
      return member;
    });
  }

  /**
   * Re-parents a member, or turns it into a root when {@code newParentId} is null. Facts
   * keep pointing at the member, so its subtree's amounts follow it to the new parent.
   */
  public Member moveMember(String memberId, String newParentId) {
    Member member = getMember(memberId);
    Dimension dimension = getDimension(member.dimensionId());
    DimensionHierarchy hierarchy = hierarchy(dimension.id());

    return hierarchy.mutate(() -> {
      Member current = hierarchy.member(memberId);
      if (current == null) {
        throw new NotFoundException("Member not found: " + memberId, ErrorCodes.UNKNOWN_MEMBER);
      }
      if (Objects.equals(current.parentId(), newParentId)) {
        return current;
      }
      if (newParentId != null) {
        requireParentInDimension(hierarchy, dimension, newParentId);
        if (hierarchy.wouldCreateCycle(memberId, newParentId)) {
          log.warn("Rejected move of member {} under {}: cycle in dimension {}", memberId,
              newParentId, dimension.id());
          throw new ValidationException("Moving member " + current.name() + " under "
              + newParentId + " would create a cycle", ErrorCodes.HIERARCHY_CYCLE);
        }
      }
      Member moved = current.withParent(newParentId);
      repository.updateMember(moved);
      hierarchy.replace(moved);
      log.info("Moved member {} in dimension {} from {} to {}", memberId, dimension.id(),
          current.parentId(), newParentId);
      return moved;
    });
  }

  public Member renameMember(String memberId, String name, String code) {
    if (!StringUtils.hasText(name)) {
      throw new ValidationException("Member name is required", ErrorCodes.MISSING_FIELD);
    }
    Member member = getMember(memberId);
    Dimension dimension = getDimension(member.dimensionId());
    String memberName = name.trim();
    String memberCode = normalizeCode(code);
    DimensionHierarchy hierarchy = hierarchy(dimension.id());

    return hierarchy.mutate(() -> {
      Member current = hierarchy.member(memberId);
      if (current == null) {
        throw new NotFoundException("Member not found: " + memberId, ErrorCodes.UNKNOWN_MEMBER);
      }
      Member sameName = hierarchy.findByName(memberName);
      if (sameName != null && !sameName.id().equals(memberId)) {
        throw new ConflictException("Member '" + memberName + "' already exists in dimension "
            + dimension.name(), ErrorCodes.DUPLICATE_NAME);
      }
      requireUniqueCode(hierarchy, dimension, memberCode, memberId);
      Member renamed = current.withNameAndCode(memberName, memberCode);
      repository.updateMember(renamed);
      hierarchy.replace(renamed);
      return renamed;
    });
  }

  /** Deletes a leaf member that no fact references. */
  public void removeMember(String memberId) {
    Member member = getMember(memberId);
    DimensionHierarchy hierarchy = hierarchy(member.dimensionId());

    hierarchy.mutate(() -> {
      Member current = hierarchy.member(memberId);
      if (current == null) {
        throw new NotFoundException("Member not found: " + memberId, ErrorCodes.UNKNOWN_MEMBER);
      }
      if (hierarchy.hasChildren(memberId)) {
        throw new ConflictException("Member " + current.name() + " still has child members",
            ErrorCodes.MEMBER_IN_USE);
      }
      if (factRepository.referencesMember(memberId)) {
        throw new ConflictException("Member " + current.name() + " is referenced by facts",
            ErrorCodes.MEMBER_IN_USE);
      }
      repository.deleteMember(memberId);
      hierarchy.remove(current);
      log.info("Removed member {} from dimension {}", memberId, current.dimensionId());
      return null;
    });
  }

  private Dimension provision(String scopeId, DimensionType type, int displayOrder) {
    Dimension candidate = new Dimension(newId(), scopeId, type, type.label(), displayOrder);
    Dimension stored = repository.insertDimensionIfAbsent(candidate);
    DimensionHierarchy hierarchy = hierarchy(stored.id());
    hierarchy.mutate(() -> {
      if (hierarchy.isEmpty()) {
        Member root = new Member(newId(), stored.id(), type.rootName(), ROOT_CODE, null);
        repository.insertMember(root);
        hierarchy.add(root);
        log.info("Provisioned dimension {} ({}) in scope {}", type.label(), stored.id(),
            scopeId);
      }
      return null;
    });
    return stored;
  }

  private DimensionHierarchy hierarchy(String dimensionId) {
    return hierarchies.computeIfAbsent(dimensionId,
        id -> new DimensionHierarchy(id, repository.findMembers(id)));
  }

  private void requireParentInDimension(DimensionHierarchy hierarchy, Dimension dimension,
      String parentId) {
    if (hierarchy.member(parentId) != null) {
      return;
    }
    boolean elsewhere = repository.findMember(parentId).isPresent();
    throw new ValidationException(elsewhere
        ? "Parent " + parentId + " belongs to another dimension than " + dimension.name()
        : "Parent member not found: " + parentId, ErrorCodes.INVALID_PARENT);
  }

  private static void requireUniqueCode(DimensionHierarchy hierarchy, Dimension dimension,
      String code, String selfId) {
    Member sameCode = hierarchy.findByCode(code);
    if (sameCode != null && !sameCode.id().equals(selfId)) {
      throw new ConflictException("Member code " + code + " already used in dimension "
          + dimension.name(), ErrorCodes.DUPLICATE_CODE);
    }
  }

  private static void requireScope(String scopeId) {
    if (!StringUtils.hasText(scopeId)) {
      throw new ValidationException("scopeId must be provided", ErrorCodes.MISSING_FIELD);
    }
  }

  private static String normalizeCode(String code) {
    return StringUtils.hasText(code) ? code.trim() : null;
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }
}
