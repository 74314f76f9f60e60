package com.ospicorp.planningcube.fact.repository;

import com.ospicorp.planningcube.fact.model.Fact;
import com.ospicorp.planningcube.fact.model.FactKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Facts keyed by natural key, plus a secondary index from {@code (scope, metric)} to the keys
 * written under it so that scans never touch other metrics.
 */
@Repository
@ConditionalOnProperty(name = "planning.cube.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryFactRepository implements FactRepository {
  private final Map<FactKey, Fact> facts = new ConcurrentHashMap<>();
  private final Map<MetricKey, Set<FactKey>> byMetric = new ConcurrentHashMap<>();

  @Override
  public Fact upsert(Fact fact) {
    FactKey key = fact.key();
    Fact stored = facts.compute(key, (k, current) -> current == null
        ? fact
        : current.withIdAndValue(current.id(), fact.value()));
    byMetric.computeIfAbsent(new MetricKey(fact.scopeId(), fact.metricName()),
        k -> ConcurrentHashMap.newKeySet()).add(key);
    return stored;
  }

  @Override
  public Optional<Fact> findByKey(FactKey key) {
    return Optional.ofNullable(facts.get(key));
  }

  @Override
  public List<Fact> findByMetric(String scopeId, String metricName) {
    Set<FactKey> keys = byMetric.get(new MetricKey(scopeId, metricName));
    if (keys == null) {
      return List.of();
    }
    List<Fact> out = new ArrayList<>(keys.size());
    for (FactKey key : keys) {
      Fact fact = facts.get(key);
      if (fact != null) {
        out.add(fact);
      }
    }
    return out;
  }

  @Override
  public boolean existsMetric(String scopeId, String metricName) {
    return byMetric.containsKey(new MetricKey(scopeId, metricName));
  }

  @Override
  public Set<String> findMetricNames(String scopeId) {
    Set<String> names = new TreeSet<>();
    for (MetricKey key : byMetric.keySet()) {
      if (key.scopeId().equals(scopeId)) {
        names.add(key.metricName());
      }
    }
    return names;
  }

  @Override
  public boolean referencesMember(String memberId) {
    for (Fact fact : facts.values()) {
      if (fact.assignment().containsValue(memberId)) {
        return true;
      }
    }
    return false;
  }

  private record MetricKey(String scopeId, String metricName) {}
}
