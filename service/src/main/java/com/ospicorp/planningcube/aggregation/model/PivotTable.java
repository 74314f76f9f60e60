package com.ospicorp.planningcube.aggregation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Cross-tab of one metric over two dimensions. {@code cells}, {@code rowTotals} and
 * {@code columnTotals} are keyed by member id; every row/column pair has a cell.
 *
 * @param unassignedTotal amount of matching facts that lack a row or a column assignment
 *                        and therefore contribute to no cell
 */
public record PivotTable(
    @JsonProperty("row_dimension") DimensionType rowDimension,
    @JsonProperty("column_dimension") DimensionType columnDimension,
    List<AxisMember> rows,
    List<AxisMember> columns,
    Map<String, Map<String, BigDecimal>> cells,
    @JsonProperty("row_totals") Map<String, BigDecimal> rowTotals,
    @JsonProperty("column_totals") Map<String, BigDecimal> columnTotals,
    @JsonProperty("grand_total") BigDecimal grandTotal,
    @JsonProperty("unassigned_total") BigDecimal unassignedTotal
) {

  public BigDecimal cell(String rowMemberId, String columnMemberId) {
    Map<String, BigDecimal> row = cells.get(rowMemberId);
    BigDecimal value = row == null ? null : row.get(columnMemberId);
    return value == null ? BigDecimal.ZERO : value;
  }
}
