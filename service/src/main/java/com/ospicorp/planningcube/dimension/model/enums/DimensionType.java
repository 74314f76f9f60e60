package com.ospicorp.planningcube.dimension.model.enums;

import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.NotFoundException;
import java.util.Locale;

public enum DimensionType {
  DEPARTMENT("Department", "All Departments", "department"),
  REGION("Region", "All Regions", "geography"),
  PRODUCT_LINE("Product Line", "All Product Lines", "product"),
  CUSTOMER_SEGMENT("Customer Segment", "All Customer Segments", "segment"),
  CHANNEL("Channel", "All Channels", "channel"),
  SCENARIO("Scenario", "All Scenarios", "scenario");

  private final String label;
  private final String rootName;
  private final String shortCode;

  DimensionType(String label, String rootName, String shortCode) {
    this.label = label;
    this.rootName = rootName;
    this.shortCode = shortCode;
  }

  public String label() {
    return label;
  }

  /** Name of the single root member every dimension of this type starts with. */
  public String rootName() {
    return rootName;
  }

  public String shortCode() {
    return shortCode;
  }

  /**
   * Accepts the enum name, the display label or the short code used by the planning UI,
   * ignoring case and separators ({@code "Product Line"}, {@code "product_line"},
   * {@code "product"} all resolve to {@link #PRODUCT_LINE}).
   */
  public static DimensionType parse(String value) {
    if (value == null || value.isBlank()) {
      throw new NotFoundException("Dimension type must be provided",
          ErrorCodes.UNKNOWN_DIMENSION_TYPE);
    }
    String normalized = normalize(value);
    for (DimensionType type : values()) {
      if (normalize(type.name()).equals(normalized)
          || normalize(type.label).equals(normalized)
          || type.shortCode.equals(normalized)) {
        return type;
      }
    }
    throw new NotFoundException("Unknown dimension type: " + value,
        ErrorCodes.UNKNOWN_DIMENSION_TYPE);
  }

  private static String normalize(String value) {
    return value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
  }
}
