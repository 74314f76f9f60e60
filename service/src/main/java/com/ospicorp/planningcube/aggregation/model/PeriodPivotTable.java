package com.ospicorp.planningcube.aggregation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Cross-tab of one metric by the members of a dimension and by month. Columns are months in
 * calendar order; {@code cells} and {@code rowTotals} are keyed by member id.
 *
 * @param periodTotals    per month, the amount of facts that carry a row assignment
 * @param unassignedTotal amount of matching facts without a row assignment
 */
public record PeriodPivotTable(
    @JsonProperty("row_dimension") DimensionType rowDimension,
    List<AxisMember> rows,
    List<YearMonth> periods,
    Map<String, Map<YearMonth, BigDecimal>> cells,
    @JsonProperty("row_totals") Map<String, BigDecimal> rowTotals,
    @JsonProperty("period_totals") Map<YearMonth, BigDecimal> periodTotals,
    @JsonProperty("grand_total") BigDecimal grandTotal,
    @JsonProperty("unassigned_total") BigDecimal unassignedTotal
) {

  public BigDecimal cell(String rowMemberId, YearMonth period) {
    Map<YearMonth, BigDecimal> row = cells.get(rowMemberId);
    BigDecimal value = row == null ? null : row.get(period);
    return value == null ? BigDecimal.ZERO : value;
  }
}
