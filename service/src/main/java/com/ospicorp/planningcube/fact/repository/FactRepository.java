package com.ospicorp.planningcube.fact.repository;

import com.ospicorp.planningcube.fact.model.Fact;
import com.ospicorp.planningcube.fact.model.FactKey;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence collaborator for facts. The only write is a natural-key upsert, which must be
 * atomic per key so that the last write to a key wins.
 */
public interface FactRepository {

  /**
   * Stores the fact under its natural key. When the key already holds a fact, that fact keeps
   * its id and takes the new value. Returns the stored fact.
   */
  Fact upsert(Fact fact);

  Optional<Fact> findByKey(FactKey key);

  /** All facts of one metric in a scope, in no particular order. */
  List<Fact> findByMetric(String scopeId, String metricName);

  boolean existsMetric(String scopeId, String metricName);

  Set<String> findMetricNames(String scopeId);

  boolean referencesMember(String memberId);
}
