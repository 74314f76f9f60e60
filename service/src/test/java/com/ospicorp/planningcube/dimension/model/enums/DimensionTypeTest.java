package com.ospicorp.planningcube.dimension.model.enums;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.ospicorp.planningcube.error.NotFoundException;
import org.junit.jupiter.api.Test;

class DimensionTypeTest {

  @Test
  void parseAcceptsNamesLabelsAndShortCodes() {
    assertEquals(DimensionType.PRODUCT_LINE, DimensionType.parse("Product Line"));
    assertEquals(DimensionType.PRODUCT_LINE, DimensionType.parse("product_line"));
    assertEquals(DimensionType.PRODUCT_LINE, DimensionType.parse("product"));
    assertEquals(DimensionType.REGION, DimensionType.parse("geography"));
    assertEquals(DimensionType.CUSTOMER_SEGMENT, DimensionType.parse(" customer-segment "));
    assertEquals(DimensionType.DEPARTMENT, DimensionType.parse("DEPARTMENT"));
  }

  @Test
  void parseRejectsUnknownTypes() {
    assertThatThrownBy(() -> DimensionType.parse("Weather"))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("Weather");
    assertThatThrownBy(() -> DimensionType.parse(" "))
        .isInstanceOf(NotFoundException.class);
  }
}
