package com.ospicorp.planningcube.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class CubePropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(CubeConfig.class);

  @Test
  void defaultsApplyWithoutConfiguration() {
    runner.run(context -> {
      CubeProperties properties = context.getBean(CubeProperties.class);
      assertThat(properties.store()).isEqualTo("memory");
      assertThat(properties.defaultDimensions()).hasSize(5).startsWith(DimensionType.DEPARTMENT);
      assertThat(properties.rollupDepth()).isEqualTo(1);
      assertThat(properties.strictMetricLookup()).isTrue();
      assertThat(properties.deadlineCheckInterval()).isEqualTo(256);
      assertThat(properties.hasQueryTimeout()).isFalse();
    });
  }

  @Test
  void bindsOverrides() {
    runner.withPropertyValues(
            "planning.cube.default-dimensions=DEPARTMENT,SCENARIO",
            "planning.cube.amount-scale=2",
            "planning.cube.query-timeout=5s")
        .run(context -> {
          CubeProperties properties = context.getBean(CubeProperties.class);
          assertThat(properties.defaultDimensions())
              .containsExactly(DimensionType.DEPARTMENT, DimensionType.SCENARIO);
          assertThat(properties.amountScale()).isEqualTo(2);
          assertThat(properties.queryTimeout()).isEqualTo(Duration.ofSeconds(5));
          assertThat(properties.hasQueryTimeout()).isTrue();
        });
  }

  @Test
  void rejectsInvalidValues() {
    runner.withPropertyValues("planning.cube.amount-scale=12")
        .run(context -> assertThat(context).hasFailed());
    runner.withPropertyValues("planning.cube.store=redis")
        .run(context -> assertThat(context).hasFailed());
  }
}
