package com.ospicorp.planningcube.aggregation.service;

import com.ospicorp.planningcube.aggregation.model.AxisMember;
import com.ospicorp.planningcube.aggregation.model.DrilldownRow;
import com.ospicorp.planningcube.aggregation.model.PeriodPivotTable;
import com.ospicorp.planningcube.aggregation.model.PivotTable;
import com.ospicorp.planningcube.aggregation.model.RollupRow;
import com.ospicorp.planningcube.config.CubeProperties;
import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.Member;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import com.ospicorp.planningcube.dimension.service.DimensionCatalog;
import com.ospicorp.planningcube.dimension.service.HierarchyView;
import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.NotFoundException;
import com.ospicorp.planningcube.error.ValidationException;
import com.ospicorp.planningcube.fact.model.Fact;
import com.ospicorp.planningcube.fact.service.FactStore;
import com.ospicorp.planningcube.fact.service.Periods;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read side of the cube: rollups, drill-downs and pivot tables. Member matching is always
 * hierarchical, so a fact assigned to a leaf counts towards every ancestor of that leaf.
 */
@Service
public class AggregationEngine {
  private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final DimensionCatalog catalog;
  private final FactStore factStore;
  private final CubeProperties properties;

  public AggregationEngine(DimensionCatalog catalog, FactStore factStore,
      CubeProperties properties) {
    this.catalog = catalog;
    this.factStore = factStore;
    this.properties = properties;
  }

  public List<RollupRow> getRollup(String scopeId, String metricName, DimensionType type,
      List<String> periods) {
    return getRollup(scopeId, metricName, type, periods, null);
  }

  /**
   * Roots of the dimension and their descendants down to the configured rollup depth, in
   * hierarchy order, each with the total of its subtree. A trailing unassigned row is added
   * when some matching facts carry no member of the dimension.
   */
  public List<RollupRow> getRollup(String scopeId, String metricName, DimensionType type,
      List<String> periods, Instant deadline) {
    HierarchyView view = resolve(scopeId, metricName, type);
    List<Fact> facts = factStore.scan(scopeId, metricName, Periods.parseAll(periods), deadline);

    Map<String, BigDecimal> direct = new HashMap<>();
    Map<String, BigDecimal> directCount = new HashMap<>();
    BigDecimal unassigned = BigDecimal.ZERO;
    int unassignedCount = 0;
    for (Fact fact : facts) {
      String memberId = fact.memberFor(type);
      if (memberId == null) {
        unassigned = unassigned.add(fact.value());
        unassignedCount++;
      } else {
        direct.merge(memberId, fact.value(), BigDecimal::add);
        directCount.merge(memberId, BigDecimal.ONE, BigDecimal::add);
      }
    }
    Map<String, BigDecimal> totals = view.subtreeTotals(direct);
    Map<String, BigDecimal> counts = view.subtreeTotals(directCount);

    List<RollupRow> rows = new ArrayList<>();
    for (Member member : view.preOrder()) {
      int level = view.depth(member.id());
      if (level > properties.rollupDepth()) {
        continue;
      }
      rows.add(new RollupRow(member.id(), member.name(), member.code(), level,
          scaled(totals.get(member.id())), counts.get(member.id()).intValue(), false));
    }
    if (unassignedCount > 0) {
      rows.add(new RollupRow(null, "Unassigned", null, 0, scaled(unassigned), unassignedCount,
          true));
    }
    log.debug("Rollup of {} over {} in scope {}: {} facts, {} rows", metricName, type,
        scopeId, facts.size(), rows.size());
    return rows;
  }

  public RollupRow getMemberRollup(String scopeId, String metricName, DimensionType type,
      String memberId, List<String> periods) {
    return getMemberRollup(scopeId, metricName, type, memberId, periods, null);
  }

  /** Subtree total of any single member, whatever its depth. */
  public RollupRow getMemberRollup(String scopeId, String metricName, DimensionType type,
      String memberId, List<String> periods, Instant deadline) {
    HierarchyView view = resolve(scopeId, metricName, type);
    Member member = requireMember(view, type, memberId);
    BigDecimal total = BigDecimal.ZERO;
    int count = 0;
    for (Fact fact : factStore.scan(scopeId, metricName, Periods.parseAll(periods), deadline)) {
      if (view.isDescendantOrSelf(fact.memberFor(type), memberId)) {
        total = total.add(fact.value());
        count++;
      }
    }
    return new RollupRow(member.id(), member.name(), member.code(), view.depth(member.id()),
        scaled(total), count, false);
  }

  public List<DrilldownRow> drilldown(String scopeId, String metricName, DimensionType type,
      String memberId, DimensionType targetType) {
    return drilldown(scopeId, metricName, type, memberId, targetType, null, null);
  }

  /**
   * Expands one member into its direct children. Only facts that also carry a
   * {@code targetType} assignment are counted. Amounts assigned to the member itself are
   * reported in a trailing direct row, so the rows always add up to the member's total.
   */
  public List<DrilldownRow> drilldown(String scopeId, String metricName, DimensionType type,
      String memberId, DimensionType targetType, List<String> periods, Instant deadline) {
    HierarchyView view = resolve(scopeId, metricName, type);
    Member member = requireMember(view, type, memberId);
    if (targetType == null) {
      throw new ValidationException("Target dimension must be provided",
          ErrorCodes.MISSING_FIELD);
    }
    catalog.getDimension(scopeId, targetType);

    Set<String> subtree = view.descendantsOrSelf(memberId);
    Map<String, BigDecimal> direct = new HashMap<>();
    for (Fact fact : factStore.scan(scopeId, metricName, Periods.parseAll(periods), deadline)) {
      String assigned = fact.memberFor(type);
      if (fact.memberFor(targetType) != null && assigned != null && subtree.contains(assigned)) {
        direct.merge(assigned, fact.value(), BigDecimal::add);
      }
    }
    Map<String, BigDecimal> totals = view.subtreeTotals(direct);
    BigDecimal parentTotal = scaled(totals.get(memberId));

    List<DrilldownRow> rows = new ArrayList<>();
    for (Member child : view.children(memberId)) {
      BigDecimal value = scaled(totals.get(child.id()));
      int childCount = view.childCount(child.id());
      rows.add(new DrilldownRow(child.id(), child.name(), child.code(), value,
          percentage(value, parentTotal), childCount, childCount > 0, false));
    }
    BigDecimal own = direct.get(memberId);
    if (own != null) {
      BigDecimal value = scaled(own);
      rows.add(new DrilldownRow(member.id(), member.name(), member.code(), value,
          percentage(value, parentTotal), 0, false, true));
    }
    return rows;
  }

  public PivotTable getPivotTable(String scopeId, String metricName, DimensionType rowType,
      DimensionType columnType, List<String> periods) {
    return getPivotTable(scopeId, metricName, rowType, columnType, periods, null);
  }

  /**
   * Two-axis cross-tab. A fact contributes to cell (r, c) when its row member is r or below
   * r and its column member is c or below c. Axes list the members the contributing facts
   * are assigned to, or every member when no fact contributes.
   */
  public PivotTable getPivotTable(String scopeId, String metricName, DimensionType rowType,
      DimensionType columnType, List<String> periods, Instant deadline) {
    HierarchyView rowView = resolve(scopeId, metricName, rowType);
    HierarchyView columnView = resolve(scopeId, metricName, columnType);

    List<Fact> contributing = new ArrayList<>();
    BigDecimal unassigned = BigDecimal.ZERO;
    for (Fact fact : factStore.scan(scopeId, metricName, Periods.parseAll(periods), deadline)) {
      if (fact.memberFor(rowType) != null && fact.memberFor(columnType) != null) {
        contributing.add(fact);
      } else {
        unassigned = unassigned.add(fact.value());
      }
    }

    List<AxisMember> rows = axis(rowView, rowType, contributing);
    List<AxisMember> columns = axis(columnView, columnType, contributing);
    Map<String, Map<String, BigDecimal>> cells = new LinkedHashMap<>();
    Map<String, BigDecimal> rowTotals = new LinkedHashMap<>();
    Map<String, BigDecimal> columnTotals = new LinkedHashMap<>();
    for (AxisMember row : rows) {
      Map<String, BigDecimal> line = new LinkedHashMap<>();
      for (AxisMember column : columns) {
        line.put(column.id(), zero());
      }
      cells.put(row.id(), line);
      rowTotals.put(row.id(), zero());
    }
    for (AxisMember column : columns) {
      columnTotals.put(column.id(), zero());
    }

    BigDecimal grandTotal = zero();
    for (Fact fact : contributing) {
      List<String> rowHits = hits(rowView, fact.memberFor(rowType), rowTotals.keySet());
      List<String> columnHits = hits(columnView, fact.memberFor(columnType),
          columnTotals.keySet());
      for (String r : rowHits) {
        rowTotals.merge(r, fact.value(), BigDecimal::add);
        Map<String, BigDecimal> line = cells.get(r);
        for (String c : columnHits) {
          line.merge(c, fact.value(), BigDecimal::add);
        }
      }
      for (String c : columnHits) {
        columnTotals.merge(c, fact.value(), BigDecimal::add);
      }
      grandTotal = grandTotal.add(fact.value());
    }
    log.debug("Pivot of {} by {} x {} in scope {}: {}x{} from {} facts", metricName, rowType,
        columnType, scopeId, rows.size(), columns.size(), contributing.size());
    return new PivotTable(rowType, columnType, rows, columns, cells, rowTotals, columnTotals,
        grandTotal, scaled(unassigned));
  }

  public PeriodPivotTable getPivotTableByPeriod(String scopeId, String metricName,
      DimensionType rowType, List<String> periods) {
    return getPivotTableByPeriod(scopeId, metricName, rowType, periods, null);
  }

  /**
   * Cross-tab of one dimension against months. Columns are the requested months, or the
   * months present among matching facts when no filter is given. Row matching is
   * hierarchical as in {@link #getPivotTable}.
   */
  public PeriodPivotTable getPivotTableByPeriod(String scopeId, String metricName,
      DimensionType rowType, List<String> periods, Instant deadline) {
    HierarchyView rowView = resolve(scopeId, metricName, rowType);
    Set<YearMonth> requested = Periods.parseAll(periods);

    List<Fact> contributing = new ArrayList<>();
    Set<YearMonth> columns = new TreeSet<>(requested);
    BigDecimal unassigned = BigDecimal.ZERO;
    for (Fact fact : factStore.scan(scopeId, metricName, requested, deadline)) {
      columns.add(fact.period());
      if (fact.memberFor(rowType) != null) {
        contributing.add(fact);
      } else {
        unassigned = unassigned.add(fact.value());
      }
    }

    List<AxisMember> rows = axis(rowView, rowType, contributing);
    Map<String, Map<YearMonth, BigDecimal>> cells = new LinkedHashMap<>();
    Map<String, BigDecimal> rowTotals = new LinkedHashMap<>();
    Map<YearMonth, BigDecimal> periodTotals = new LinkedHashMap<>();
    for (YearMonth period : columns) {
      periodTotals.put(period, zero());
    }
    for (AxisMember row : rows) {
      Map<YearMonth, BigDecimal> line = new LinkedHashMap<>();
      for (YearMonth period : columns) {
        line.put(period, zero());
      }
      cells.put(row.id(), line);
      rowTotals.put(row.id(), zero());
    }

    BigDecimal grandTotal = zero();
    for (Fact fact : contributing) {
      for (String r : hits(rowView, fact.memberFor(rowType), rowTotals.keySet())) {
        rowTotals.merge(r, fact.value(), BigDecimal::add);
        cells.get(r).merge(fact.period(), fact.value(), BigDecimal::add);
      }
      periodTotals.merge(fact.period(), fact.value(), BigDecimal::add);
      grandTotal = grandTotal.add(fact.value());
    }
    log.debug("Pivot of {} by {} x period in scope {}: {}x{} from {} facts", metricName,
        rowType, scopeId, rows.size(), columns.size(), contributing.size());
    return new PeriodPivotTable(rowType, rows, new ArrayList<>(columns), cells, rowTotals,
        periodTotals, grandTotal, scaled(unassigned));
  }

  private HierarchyView resolve(String scopeId, String metricName, DimensionType type) {
    if (!StringUtils.hasText(scopeId)) {
      throw new ValidationException("scopeId must be provided", ErrorCodes.MISSING_FIELD);
    }
    if (!StringUtils.hasText(metricName)) {
      throw new ValidationException("metricName must be provided", ErrorCodes.MISSING_FIELD);
    }
    if (type == null) {
      throw new ValidationException("Dimension type must be provided", ErrorCodes.MISSING_FIELD);
    }
    Dimension dimension = catalog.getDimension(scopeId, type);
    if (properties.strictMetricLookup() && !factStore.hasMetric(scopeId, metricName)) {
      throw new NotFoundException("Metric " + metricName + " has no facts in scope " + scopeId,
          ErrorCodes.UNKNOWN_METRIC);
    }
    return catalog.view(dimension.id());
  }

  private static Member requireMember(HierarchyView view, DimensionType type, String memberId) {
    if (!StringUtils.hasText(memberId)) {
      throw new ValidationException("memberId must be provided", ErrorCodes.MISSING_FIELD);
    }
    Member member = view.member(memberId);
    if (member == null) {
      throw new NotFoundException("Member " + memberId + " is not part of dimension "
          + type.label(), ErrorCodes.UNKNOWN_MEMBER);
    }
    return member;
  }

  private static List<AxisMember> axis(HierarchyView view, DimensionType type,
      List<Fact> contributing) {
    Set<String> present = new LinkedHashSet<>();
    for (Fact fact : contributing) {
      present.add(fact.memberFor(type));
    }
    List<AxisMember> out = new ArrayList<>();
    for (Member member : view.preOrder()) {
      if (present.isEmpty() || present.contains(member.id())) {
        out.add(new AxisMember(member.id(), member.name(), member.code(),
            view.depth(member.id())));
      }
    }
    return out;
  }

  // The assigned member and those of its ancestors that are on the axis.
  private static List<String> hits(HierarchyView view, String memberId, Set<String> onAxis) {
    List<String> out = new ArrayList<>();
    if (onAxis.contains(memberId)) {
      out.add(memberId);
    }
    for (String ancestor : view.ancestors(memberId)) {
      if (onAxis.contains(ancestor)) {
        out.add(ancestor);
      }
    }
    return out;
  }

  private BigDecimal percentage(BigDecimal value, BigDecimal total) {
    if (total.signum() == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return value.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_EVEN);
  }

  private BigDecimal zero() {
    return BigDecimal.ZERO.setScale(properties.amountScale());
  }

  private BigDecimal scaled(BigDecimal value) {
    if (value == null) {
      return zero();
    }
    return value.scale() >= properties.amountScale() ? value
        : value.setScale(properties.amountScale());
  }
}
