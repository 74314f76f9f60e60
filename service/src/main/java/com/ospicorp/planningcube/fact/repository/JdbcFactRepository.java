package com.ospicorp.planningcube.fact.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import com.ospicorp.planningcube.fact.model.Fact;
import com.ospicorp.planningcube.fact.model.FactKey;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "planning.cube.store", havingValue = "jdbc")
public class JdbcFactRepository implements FactRepository {
  private static final TypeReference<Map<String, String>> ASSIGNMENT_TYPE =
      new TypeReference<>() {};

  private final JdbcTemplate jdbc;
  private final ObjectMapper mapper;

  public JdbcFactRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
    this.jdbc = jdbc;
    this.mapper = mapper;
  }

  @Override
  public Fact upsert(Fact fact) {
    String sql = """
      INSERT INTO cube_fact (id, natural_key, scope_id, metric_name, period, value, assignment)
      VALUES (?, ?, ?, ?, ?, ?, CAST(? AS JSONB))
      ON CONFLICT (natural_key) DO UPDATE SET value = EXCLUDED.value
      RETURNING id
    """;
    String storedId = jdbc.queryForObject(sql, String.class,
        fact.id(),
        fact.key().canonical(),
        fact.scopeId(),
        fact.metricName(),
        fact.period().toString(),
        fact.value(),
        writeAssignment(fact.assignment()));
    return fact.withIdAndValue(storedId, fact.value());
  }

  @Override
  public Optional<Fact> findByKey(FactKey key) {
    String sql = """
      SELECT id, scope_id, metric_name, period, value, assignment::text AS assignment
      FROM cube_fact
      WHERE natural_key = ?
    """;
    return jdbc.query(sql, (rs, i) -> mapFact(rs), key.canonical()).stream().findFirst();
  }

  @Override
  public List<Fact> findByMetric(String scopeId, String metricName) {
    String sql = """
      SELECT id, scope_id, metric_name, period, value, assignment::text AS assignment
      FROM cube_fact
      WHERE scope_id = ? AND metric_name = ?
      ORDER BY period, natural_key
    """;
    return jdbc.query(sql, (rs, i) -> mapFact(rs), scopeId, metricName);
  }

  @Override
  public boolean existsMetric(String scopeId, String metricName) {
    Boolean exists = jdbc.queryForObject(
        "SELECT EXISTS (SELECT 1 FROM cube_fact WHERE scope_id = ? AND metric_name = ?)",
        Boolean.class, scopeId, metricName);
    return Boolean.TRUE.equals(exists);
  }

  @Override
  public Set<String> findMetricNames(String scopeId) {
    return new LinkedHashSet<>(jdbc.queryForList(
        "SELECT DISTINCT metric_name FROM cube_fact WHERE scope_id = ? ORDER BY metric_name",
        String.class, scopeId));
  }

  @Override
  public boolean referencesMember(String memberId) {
    String sql = """
      SELECT EXISTS (
        SELECT 1 FROM cube_fact f, jsonb_each_text(f.assignment) a
        WHERE a.value = ?
      )
    """;
    Boolean exists = jdbc.queryForObject(sql, Boolean.class, memberId);
    return Boolean.TRUE.equals(exists);
  }

  private Fact mapFact(ResultSet rs) throws SQLException {
    return new Fact(
        rs.getString("id"),
        rs.getString("scope_id"),
        rs.getString("metric_name"),
        YearMonth.parse(rs.getString("period")),
        rs.getBigDecimal("value"),
        readAssignment(rs.getString("assignment")));
  }

  private String writeAssignment(Map<DimensionType, String> assignment) {
    Map<String, String> raw = new TreeMap<>();
    assignment.forEach((type, memberId) -> raw.put(type.name(), memberId));
    try {
      return mapper.writeValueAsString(raw);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize fact assignment", ex);
    }
  }

  private Map<DimensionType, String> readAssignment(String json) {
    try {
      Map<String, String> raw = mapper.readValue(json, ASSIGNMENT_TYPE);
      Map<DimensionType, String> out = new EnumMap<>(DimensionType.class);
      raw.forEach((type, memberId) -> out.put(DimensionType.valueOf(type), memberId));
      return out;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Corrupt fact assignment: " + json, ex);
    }
  }
}
