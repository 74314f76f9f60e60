package com.ospicorp.planningcube.dimension.service;

import com.ospicorp.planningcube.config.CubeProperties;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Dimension types every planning model starts with. Bump {@link #VERSION} whenever the
 * default list changes so that seeded scopes can be told apart in logs.
 */
@Component
public class DefaultDimensionSeed {
  public static final int VERSION = 1;

  private final List<DimensionType> dimensions;

  public DefaultDimensionSeed(CubeProperties properties) {
    this.dimensions = List.copyOf(properties.defaultDimensions());
  }

  public int version() {
    return VERSION;
  }

  public List<DimensionType> dimensions() {
    return dimensions;
  }
}
