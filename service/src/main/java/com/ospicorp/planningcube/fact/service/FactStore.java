package com.ospicorp.planningcube.fact.service;

import com.ospicorp.planningcube.config.CubeProperties;
import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import com.ospicorp.planningcube.dimension.service.DimensionCatalog;
import com.ospicorp.planningcube.dimension.service.HierarchyView;
import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.NotFoundException;
import com.ospicorp.planningcube.error.ValidationException;
import com.ospicorp.planningcube.fact.model.CubeQuery;
import com.ospicorp.planningcube.fact.model.CubeRow;
import com.ospicorp.planningcube.fact.model.Fact;
import com.ospicorp.planningcube.fact.model.FactKey;
import com.ospicorp.planningcube.fact.repository.FactRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class FactStore {
  private static final Logger log = LoggerFactory.getLogger(FactStore.class);
  static final String UNASSIGNED = "unassigned";

  private static final Comparator<Fact> SCAN_ORDER = Comparator
      .comparing(Fact::period)
      .thenComparing(fact -> fact.key().canonical());

  private final FactRepository repository;
  private final DimensionCatalog catalog;
  private final CubeProperties properties;
  private final Clock clock;

  public FactStore(FactRepository repository, DimensionCatalog catalog,
      CubeProperties properties, Clock clock) {
    this.repository = repository;
    this.catalog = catalog;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Writes one value at the cell addressed by its natural key, replacing whatever value the
   * cell held before. The assigned members cannot be removed until the write is stored.
   */
  public Fact setValue(String scopeId, String metricName, String period, Number value,
      Map<DimensionType, String> assignment) {
    requireText(scopeId, "scopeId");
    requireText(metricName, "metricName");
    YearMonth month = Periods.parse(period);
    BigDecimal amount = Amounts.toAmount(value, properties.amountScale());
    Map<DimensionType, String> validated = validateAssignment(assignment);

    Fact candidate = new Fact(UUID.randomUUID().toString(), scopeId, metricName, month, amount,
        validated);
    Fact stored = catalog.withMembersPinned(scopeId, validated,
        () -> repository.upsert(candidate));
    if (stored.id().equals(candidate.id())) {
      log.debug("Inserted fact {} at {}", stored.id(), stored.key().canonical());
    } else {
      log.debug("Overwrote fact {} at {} with {}", stored.id(), stored.key().canonical(),
          amount.toPlainString());
    }
    return stored;
  }

  public Optional<Fact> find(String scopeId, String metricName, String period,
      Map<DimensionType, String> assignment) {
    requireText(scopeId, "scopeId");
    requireText(metricName, "metricName");
    return repository.findByKey(new FactKey(scopeId, metricName, Periods.parse(period),
        assignment));
  }

  public boolean hasMetric(String scopeId, String metricName) {
    return repository.existsMetric(scopeId, metricName);
  }

  public Set<String> listMetrics(String scopeId) {
    requireText(scopeId, "scopeId");
    return repository.findMetricNames(scopeId);
  }

  public List<CubeRow> query(CubeQuery query) {
    requireText(query.scopeId(), "scopeId");
    requireText(query.metricName(), "metricName");
    Set<YearMonth> periods = Periods.parseAll(query.periods());
    List<MemberFilter> filters = resolveFilters(query.scopeId(), query.filters());
    for (DimensionType axis : query.groupBy()) {
      catalog.getDimension(query.scopeId(), axis);
    }

    List<Fact> matching = new ArrayList<>();
    for (Fact fact : scan(query.scopeId(), query.metricName(), periods, query.deadline())) {
      if (matchesAll(fact, filters)) {
        matching.add(fact);
      }
    }
    return query.isGrouped() ? group(matching, query) : toRows(matching);
  }

  /**
   * Facts of one metric restricted to the given periods (all periods when empty), ordered by
   * period. Abandons the scan with a deadline failure once {@code deadline} has passed.
   */
  public List<Fact> scan(String scopeId, String metricName, Collection<YearMonth> periods,
      Instant deadline) {
    DeadlineGuard guard = new DeadlineGuard(effectiveDeadline(deadline), clock,
        properties.deadlineCheckInterval());
    guard.check();
    List<Fact> out = new ArrayList<>();
    for (Fact fact : repository.findByMetric(scopeId, metricName)) {
      guard.tick();
      if (periods == null || periods.isEmpty() || periods.contains(fact.period())) {
        out.add(fact);
      }
    }
    out.sort(SCAN_ORDER);
    return out;
  }

  private Instant effectiveDeadline(Instant deadline) {
    if (deadline != null) {
      return deadline;
    }
    return properties.hasQueryTimeout() ? clock.instant().plus(properties.queryTimeout()) : null;
  }

  private static Map<DimensionType, String> validateAssignment(
      Map<DimensionType, String> assignment) {
    Map<DimensionType, String> out = new EnumMap<>(DimensionType.class);
    if (assignment == null) {
      return out;
    }
    for (Map.Entry<DimensionType, String> entry : assignment.entrySet()) {
      DimensionType type = entry.getKey();
      String memberId = entry.getValue();
      if (type == null || !StringUtils.hasText(memberId)) {
        throw new ValidationException("Dimension assignment entries need a type and a member id",
            ErrorCodes.MISSING_FIELD);
      }
      out.put(type, memberId);
    }
    return out;
  }

  private HierarchyView requireMemberOf(String scopeId, DimensionType type, String memberId) {
    Dimension dimension = catalog.getDimension(scopeId, type);
    HierarchyView view = catalog.view(dimension.id());
    if (!view.contains(memberId)) {
      throw new NotFoundException("Member " + memberId + " is not part of dimension "
          + dimension.name() + " in scope " + scopeId, ErrorCodes.UNKNOWN_MEMBER);
    }
    return view;
  }

  private List<MemberFilter> resolveFilters(String scopeId, Map<DimensionType, String> filters) {
    List<MemberFilter> out = new ArrayList<>(filters.size());
    for (Map.Entry<DimensionType, String> entry : filters.entrySet()) {
      if (!StringUtils.hasText(entry.getValue())) {
        throw new ValidationException("Filter on " + entry.getKey().label()
            + " needs a member id", ErrorCodes.MISSING_FIELD);
      }
      HierarchyView view = requireMemberOf(scopeId, entry.getKey(), entry.getValue());
      out.add(new MemberFilter(entry.getKey(), entry.getValue(), view));
    }
    return out;
  }

  private static boolean matchesAll(Fact fact, List<MemberFilter> filters) {
    for (MemberFilter filter : filters) {
      if (!filter.view().isDescendantOrSelf(fact.memberFor(filter.type()), filter.memberId())) {
        return false;
      }
    }
    return true;
  }

  private List<CubeRow> toRows(List<Fact> facts) {
    List<CubeRow> rows = new ArrayList<>(facts.size());
    for (Fact fact : facts) {
      rows.add(new CubeRow(null, fact.id(), fact.assignment(), fact.period(), fact.value(), 1,
          fact.value()));
    }
    return rows;
  }

  private List<CubeRow> group(List<Fact> facts, CubeQuery query) {
    Map<String, Bucket> buckets = new LinkedHashMap<>();
    for (Fact fact : facts) {
      Map<DimensionType, String> dimensions = new LinkedHashMap<>();
      StringBuilder key = new StringBuilder();
      for (DimensionType axis : query.groupBy()) {
        String memberId = fact.memberFor(axis);
        dimensions.put(axis, memberId);
        appendKeyPart(key, axis.shortCode(), memberId == null ? UNASSIGNED : memberId);
      }
      YearMonth period = null;
      if (query.groupByPeriod()) {
        period = fact.period();
        appendKeyPart(key, "period", period.toString());
      }
      YearMonth bucketPeriod = period;
      buckets.computeIfAbsent(key.toString(),
          k -> new Bucket(k, dimensions, bucketPeriod)).add(fact.value());
    }

    List<CubeRow> rows = new ArrayList<>(buckets.size());
    for (Bucket bucket : buckets.values()) {
      rows.add(new CubeRow(bucket.key, null, bucket.dimensions, bucket.period, bucket.total,
          bucket.count, Amounts.average(bucket.total, bucket.count, properties.amountScale())));
    }
    return rows;
  }

  private static void appendKeyPart(StringBuilder key, String name, String value) {
    if (key.length() > 0) {
      key.append('|');
    }
    key.append(name).append(':').append(value);
  }

  private static void requireText(String value, String field) {
    if (!StringUtils.hasText(value)) {
      throw new ValidationException(field + " must be provided", ErrorCodes.MISSING_FIELD);
    }
  }

  private record MemberFilter(DimensionType type, String memberId, HierarchyView view) {}

  private static final class Bucket {
    private final String key;
    private final Map<DimensionType, String> dimensions;
    private final YearMonth period;
    private BigDecimal total = BigDecimal.ZERO;
    private int count;

    private Bucket(String key, Map<DimensionType, String> dimensions, YearMonth period) {
      this.key = key;
      this.dimensions = dimensions;
      this.period = period;
    }

    private void add(BigDecimal value) {
      total = total.add(value);
      count++;
    }
  }
}
