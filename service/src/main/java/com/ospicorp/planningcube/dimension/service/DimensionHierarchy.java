package com.ospicorp.planningcube.dimension.service;

import com.ospicorp.planningcube.dimension.model.Member;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Live member index of a single dimension. Structural changes run under the write lock and
 * patch the parent-to-children adjacency in place; the read side is served by a cached
 * {@link HierarchyView} that is discarded before a mutation releases the lock.
 */
final class DimensionHierarchy {
  private final String dimensionId;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Member> members = new LinkedHashMap<>();
  private final List<String> roots = new ArrayList<>();
  private final Map<String, List<String>> children = new HashMap<>();
  private volatile HierarchyView view;

  DimensionHierarchy(String dimensionId, List<Member> loaded) {
    this.dimensionId = dimensionId;
    for (Member member : loaded) {
      link(member);
    }
  }

  HierarchyView view() {
    HierarchyView current = view;
    if (current != null) {
      return current;
    }
    lock.readLock().lock();
    try {
      current = view;
      if (current == null) {
        current = new HierarchyView(dimensionId, members, roots, children);
        view = current;
      }
      return current;
    } finally {
      lock.readLock().unlock();
    }
  }

  <T> T mutate(Supplier<T> action) {
    lock.writeLock().lock();
    try {
      return action.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  // Readers that must keep members from being removed while they work; released with
  // unlockRead() on the same thread.
  void lockRead() {
    lock.readLock().lock();
  }

  void unlockRead() {
    lock.readLock().unlock();
  }

  // Everything below expects the write lock to be held, or the read lock for lookups.

  boolean isEmpty() {
    return members.isEmpty();
  }

  Member member(String memberId) {
    return members.get(memberId);
  }

  boolean hasChildren(String memberId) {
    List<String> kids = children.get(memberId);
    return kids != null && !kids.isEmpty();
  }

  Member findByName(String name) {
    for (Member member : members.values()) {
      if (member.name().equalsIgnoreCase(name)) {
        return member;
      }
    }
    return null;
  }

  Member findByCode(String code) {
    if (code == null) {
      return null;
    }
    for (Member member : members.values()) {
      if (code.equalsIgnoreCase(member.code())) {
        return member;
      }
    }
    return null;
  }

  /**
   * Walks up from the proposed parent using the live parent pointers and reports whether the
   * walk reaches {@code memberId}, or revisits a node, before it ends at a root.
   */
  boolean wouldCreateCycle(String memberId, String proposedParentId) {
    Set<String> visited = new HashSet<>();
    String current = proposedParentId;
    while (current != null) {
      if (current.equals(memberId) || !visited.add(current)) {
        return true;
      }
      Member node = members.get(current);
      current = node == null ? null : node.parentId();
    }
    return false;
  }

  void add(Member member) {
    link(member);
    view = null;
  }

  void replace(Member updated) {
    Member previous = members.get(updated.id());
    if (previous == null) {
      throw new IllegalStateException("Member " + updated.id() + " is not indexed in dimension "
          + dimensionId);
    }
    if (!Objects.equals(previous.parentId(), updated.parentId())) {
      unlink(previous);
      link(updated);
    } else {
      members.put(updated.id(), updated);
    }
    view = null;
  }

  void remove(Member member) {
    unlink(member);
    members.remove(member.id());
    children.remove(member.id());
    view = null;
  }

  private void link(Member member) {
    members.put(member.id(), member);
    if (member.parentId() == null) {
      roots.add(member.id());
    } else {
      children.computeIfAbsent(member.parentId(), key -> new ArrayList<>()).add(member.id());
    }
  }

  private void unlink(Member member) {
    if (member.parentId() == null) {
      roots.remove(member.id());
      return;
    }
    List<String> siblings = children.get(member.parentId());
    if (siblings != null) {
      siblings.remove(member.id());
      if (siblings.isEmpty()) {
        children.remove(member.parentId());
      }
    }
  }
}
