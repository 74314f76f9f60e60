package com.ospicorp.planningcube.config;

import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "planning.cube")
public record CubeProperties(
    @DefaultValue("memory") @Pattern(regexp = "memory|jdbc") String store,
    @DefaultValue({"DEPARTMENT", "REGION", "PRODUCT_LINE", "CUSTOMER_SEGMENT", "CHANNEL"})
    @NotEmpty List<DimensionType> defaultDimensions,
    @DefaultValue("4") @Min(0) @Max(8) int amountScale,
    @DefaultValue("1") @Min(0) int rollupDepth,
    @DefaultValue("true") boolean strictMetricLookup,
    Duration queryTimeout,
    @DefaultValue("256") @Min(1) int deadlineCheckInterval
) {

  public boolean hasQueryTimeout() {
    return queryTimeout != null && !queryTimeout.isZero() && !queryTimeout.isNegative();
  }
}
