package com.ospicorp.planningcube.dimension.service;

import com.ospicorp.planningcube.dimension.model.Member;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable snapshot of one dimension's member forest. Ancestor chains are resolved lazily
 * and cached for the lifetime of the snapshot; the owning {@link DimensionHierarchy} drops
 * the snapshot on every structural change.
 */
public final class HierarchyView {
  private final String dimensionId;
  private final Map<String, Member> members;
  private final List<String> roots;
  private final Map<String, List<String>> children;
  private final Map<String, List<String>> ancestorCache = new ConcurrentHashMap<>();

  HierarchyView(String dimensionId, Map<String, Member> members, List<String> roots,
      Map<String, List<String>> children) {
    this.dimensionId = dimensionId;
    this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    this.roots = List.copyOf(roots);
    Map<String, List<String>> copy = new HashMap<>(children.size());
    children.forEach((parent, kids) -> copy.put(parent, List.copyOf(kids)));
    this.children = copy;
  }

  public String dimensionId() {
    return dimensionId;
  }

  public boolean contains(String memberId) {
    return memberId != null && members.containsKey(memberId);
  }

  public Member member(String memberId) {
    return members.get(memberId);
  }

  public int size() {
    return members.size();
  }

  public List<Member> roots() {
    return toMembers(roots);
  }

  public List<Member> children(String memberId) {
    return toMembers(children.getOrDefault(memberId, List.of()));
  }

  public int childCount(String memberId) {
    return children.getOrDefault(memberId, List.of()).size();
  }

  /** Ancestor ids of the member, nearest parent first; empty for a root. */
  public List<String> ancestors(String memberId) {
    List<String> cached = ancestorCache.get(memberId);
    if (cached != null) {
      return cached;
    }
    Member member = members.get(memberId);
    if (member == null) {
      return List.of();
    }
    List<String> chain = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    seen.add(memberId);
    String current = member.parentId();
    while (current != null) {
      if (!seen.add(current)) {
        throw new IllegalStateException("Cycle in dimension " + dimensionId + " at member "
            + current);
      }
      chain.add(current);
      Member parent = members.get(current);
      current = parent == null ? null : parent.parentId();
    }
    List<String> result = List.copyOf(chain);
    ancestorCache.putIfAbsent(memberId, result);
    return result;
  }

  public int depth(String memberId) {
    return ancestors(memberId).size();
  }

  public boolean isDescendantOrSelf(String memberId, String ancestorId) {
    if (memberId == null || ancestorId == null) {
      return false;
    }
    return memberId.equals(ancestorId) || ancestors(memberId).contains(ancestorId);
  }

  /** The member followed by all of its descendants in pre-order. */
  public Set<String> descendantsOrSelf(String memberId) {
    Set<String> out = new LinkedHashSet<>();
    if (!members.containsKey(memberId)) {
      return out;
    }
    Deque<String> stack = new ArrayDeque<>();
    stack.push(memberId);
    while (!stack.isEmpty()) {
      String id = stack.pop();
      if (!out.add(id)) {
        continue;
      }
      List<String> kids = children.getOrDefault(id, List.of());
      for (int i = kids.size() - 1; i >= 0; i--) {
        stack.push(kids.get(i));
      }
    }
    return out;
  }

  /** Every member, roots in insertion order, each followed by its subtree. */
  public List<Member> preOrder() {
    List<Member> out = new ArrayList<>(members.size());
    for (String root : roots) {
      for (String id : descendantsOrSelf(root)) {
        out.add(members.get(id));
      }
    }
    return out;
  }

  /**
   * Folds per-member amounts up the forest: the result maps every member to its own amount
   * plus the amounts of all its descendants. Members absent from {@code direct} count as zero.
   */
  public Map<String, BigDecimal> subtreeTotals(Map<String, BigDecimal> direct) {
    Map<String, BigDecimal> totals = new HashMap<>(members.size());
    List<Member> ordered = preOrder();
    for (int i = ordered.size() - 1; i >= 0; i--) {
      String id = ordered.get(i).id();
      BigDecimal sum = direct.getOrDefault(id, BigDecimal.ZERO);
      for (String child : children.getOrDefault(id, List.of())) {
        sum = sum.add(totals.getOrDefault(child, BigDecimal.ZERO));
      }
      totals.put(id, sum);
    }
    return totals;
  }

  private List<Member> toMembers(List<String> ids) {
    List<Member> out = new ArrayList<>(ids.size());
    for (String id : ids) {
      out.add(members.get(id));
    }
    return out;
  }
}
