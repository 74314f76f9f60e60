package com.ospicorp.planningcube.fact.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.planningcube.config.CubeProperties;
import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.Member;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import com.ospicorp.planningcube.dimension.repository.InMemoryDimensionRepository;
import com.ospicorp.planningcube.dimension.service.DefaultDimensionSeed;
import com.ospicorp.planningcube.dimension.service.DimensionCatalog;
import com.ospicorp.planningcube.error.ConflictException;
import com.ospicorp.planningcube.error.NotFoundException;
import com.ospicorp.planningcube.error.QueryDeadlineExceededException;
import com.ospicorp.planningcube.error.ValidationException;
import com.ospicorp.planningcube.fact.model.CubeQuery;
import com.ospicorp.planningcube.fact.model.CubeRow;
import com.ospicorp.planningcube.fact.model.Fact;
import com.ospicorp.planningcube.fact.repository.InMemoryFactRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FactStoreTest {
  private static final String SCOPE = "model-1";
  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private final CubeProperties properties = new CubeProperties("memory",
      List.of(DimensionType.DEPARTMENT, DimensionType.REGION), 4, 1, true, null, 256);

  private DimensionCatalog catalog;
  private FactStore store;
  private Member engineering;
  private Member backend;
  private Member frontend;
  private Member us;
  private Member eu;

  @BeforeEach
  void setUp() {
    InMemoryFactRepository facts = new InMemoryFactRepository();
    catalog = new DimensionCatalog(new InMemoryDimensionRepository(), facts,
        new DefaultDimensionSeed(properties));
    store = new FactStore(facts, catalog, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    catalog.initialize(SCOPE);
    Dimension department = catalog.getDimension(SCOPE, DimensionType.DEPARTMENT);
    String allDepartments = catalog.view(department.id()).roots().get(0).id();
    engineering = catalog.addMember(department.id(), "Engineering", "ENG", allDepartments);
    backend = catalog.addMember(department.id(), "Backend", "BE", engineering.id());
    frontend = catalog.addMember(department.id(), "Frontend", "FE", engineering.id());

    Dimension region = catalog.getDimension(SCOPE, DimensionType.REGION);
    String allRegions = catalog.view(region.id()).roots().get(0).id();
    us = catalog.addMember(region.id(), "US", "US", allRegions);
    eu = catalog.addMember(region.id(), "EU", "EU", allRegions);
  }

  @Test
  void setValueOverwritesSameNaturalKey() {
    Fact first = store.setValue(SCOPE, "opex", "2025-01", 100,
        Map.of(DimensionType.DEPARTMENT, backend.id()));
    Fact second = store.setValue(SCOPE, "opex", "2025-01", 250,
        Map.of(DimensionType.DEPARTMENT, backend.id()));

    assertThat(second.id()).isEqualTo(first.id());
    List<CubeRow> rows = store.query(CubeQuery.builder(SCOPE, "opex").build());
    assertThat(rows).singleElement().satisfies(row -> {
      assertThat(row.totalValue()).isEqualByComparingTo("250");
      assertThat(row.count()).isEqualTo(1);
      assertThat(row.factId()).isEqualTo(first.id());
      assertThat(row.groupKey()).isNull();
    });
  }

  @Test
  void assignmentOrderDoesNotChangeTheKey() {
    Map<DimensionType, String> one = new EnumMap<>(DimensionType.class);
    one.put(DimensionType.REGION, us.id());
    one.put(DimensionType.DEPARTMENT, backend.id());

    store.setValue(SCOPE, "opex", "2025-01", 1, one);
    store.setValue(SCOPE, "opex", "2025-01", 2,
        Map.of(DimensionType.DEPARTMENT, backend.id(), DimensionType.REGION, us.id()));

    assertThat(store.query(CubeQuery.builder(SCOPE, "opex").build())).hasSize(1);
    assertThat(store.find(SCOPE, "opex", "2025-01", one)).get()
        .extracting(Fact::value).isEqualTo(new BigDecimal("2.0000"));
  }

  @Test
  void memberRemovalWaitsForAWriteThatAssignsIt() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    AtomicReference<DimensionCatalog> catalogRef = new AtomicReference<>();
    AtomicReference<String> leafId = new AtomicReference<>();
    AtomicReference<Future<?>> removal = new AtomicReference<>();
    InMemoryFactRepository facts = new InMemoryFactRepository() {
      @Override
      public Fact upsert(Fact fact) {
        // the member check already passed; a removal started now must not get through
        Future<?> pending = executor.submit(() -> catalogRef.get().removeMember(leafId.get()));
        removal.set(pending);
        assertThatThrownBy(() -> pending.get(200, TimeUnit.MILLISECONDS))
            .isInstanceOf(TimeoutException.class);
        return super.upsert(fact);
      }
    };
    DimensionCatalog guarded = new DimensionCatalog(new InMemoryDimensionRepository(), facts,
        new DefaultDimensionSeed(properties));
    catalogRef.set(guarded);
    FactStore guardedStore = new FactStore(facts, guarded, properties,
        Clock.fixed(NOW, ZoneOffset.UTC));
    guarded.initialize(SCOPE);
    Dimension department = guarded.getDimension(SCOPE, DimensionType.DEPARTMENT);
    String root = guarded.view(department.id()).roots().get(0).id();
    Member leaf = guarded.addMember(department.id(), "Leaf", "LEAF", root);
    leafId.set(leaf.id());

    try {
      guardedStore.setValue(SCOPE, "opex", "2025-01", 50,
          Map.of(DimensionType.DEPARTMENT, leaf.id()));

      assertThatThrownBy(() -> removal.get().get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(ConflictException.class);
      assertThat(guarded.getMember(leaf.id()).name()).isEqualTo("Leaf");
      assertThat(guardedStore.find(SCOPE, "opex", "2025-01",
          Map.of(DimensionType.DEPARTMENT, leaf.id()))).isPresent();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void differentAssignmentsAreDifferentFacts() {
    store.setValue(SCOPE, "opex", "2025-01", 1, Map.of(DimensionType.DEPARTMENT, backend.id()));
    store.setValue(SCOPE, "opex", "2025-01", 2, Map.of());
    store.setValue(SCOPE, "opex", "2025-02", 3, Map.of(DimensionType.DEPARTMENT, backend.id()));
    store.setValue(SCOPE, "revenue", "2025-01", 4, Map.of());

    assertThat(store.query(CubeQuery.builder(SCOPE, "opex").build())).hasSize(3);
    assertThat(store.listMetrics(SCOPE)).containsExactlyInAnyOrder("opex", "revenue");
    assertThat(store.hasMetric(SCOPE, "capex")).isFalse();
  }

  @Test
  void setValueValidatesInput() {
    Map<DimensionType, String> assignment = Map.of(DimensionType.DEPARTMENT, backend.id());

    assertThatThrownBy(() -> store.setValue(SCOPE, "opex", "2025-13", 1, assignment))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> store.setValue(SCOPE, "opex", "2025-01", Double.NaN, assignment))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> store.setValue(SCOPE, " ", "2025-01", 1, assignment))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> store.setValue(SCOPE, "", "2025-01", 1, assignment))
        .isInstanceOf(ValidationException.class);
    assertThat(store.hasMetric(SCOPE, "opex")).isFalse();
  }

  @Test
  void setValueRejectsUnknownReferences() {
    assertThatThrownBy(() -> store.setValue(SCOPE, "opex", "2025-01", 1,
        Map.of(DimensionType.DEPARTMENT, "missing")))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> store.setValue(SCOPE, "opex", "2025-01", 1,
        Map.of(DimensionType.DEPARTMENT, us.id())))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> store.setValue(SCOPE, "opex", "2025-01", 1,
        Map.of(DimensionType.CHANNEL, backend.id())))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("Channel");
    assertThatThrownBy(() -> store.setValue("other-scope", "opex", "2025-01", 1,
        Map.of(DimensionType.DEPARTMENT, backend.id())))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void filtersMatchDescendants() {
    store.setValue(SCOPE, "opex", "2025-01", 1000, Map.of(DimensionType.DEPARTMENT, backend.id()));
    store.setValue(SCOPE, "opex", "2025-01", 500, Map.of(DimensionType.DEPARTMENT, frontend.id()));
    store.setValue(SCOPE, "opex", "2025-01", 7, Map.of(DimensionType.REGION, us.id()));

    List<CubeRow> underEngineering = store.query(CubeQuery.builder(SCOPE, "opex")
        .filter(DimensionType.DEPARTMENT, engineering.id())
        .build());
    List<CubeRow> backendOnly = store.query(CubeQuery.builder(SCOPE, "opex")
        .filter(DimensionType.DEPARTMENT, backend.id())
        .build());

    assertThat(underEngineering).extracting(CubeRow::totalValue)
        .usingElementComparator(BigDecimal::compareTo)
        .containsExactlyInAnyOrder(new BigDecimal("1000"),
            new BigDecimal("500"));
    assertThat(backendOnly).hasSize(1);
  }

  @Test
  void groupByBucketsUnassignedFactsSeparately() {
    store.setValue(SCOPE, "opex", "2025-01", 1000,
        Map.of(DimensionType.DEPARTMENT, backend.id(), DimensionType.REGION, us.id()));
    store.setValue(SCOPE, "opex", "2025-02", 200,
        Map.of(DimensionType.DEPARTMENT, frontend.id(), DimensionType.REGION, us.id()));
    store.setValue(SCOPE, "opex", "2025-01", 500,
        Map.of(DimensionType.DEPARTMENT, frontend.id(), DimensionType.REGION, eu.id()));
    store.setValue(SCOPE, "opex", "2025-01", 40, Map.of(DimensionType.DEPARTMENT, backend.id()));

    List<CubeRow> rows = store.query(CubeQuery.builder(SCOPE, "opex")
        .groupBy(DimensionType.REGION)
        .build());

    assertThat(rows).extracting(CubeRow::groupKey).containsExactlyInAnyOrder(
        "geography:" + us.id(), "geography:" + eu.id(), "geography:unassigned");
    Map<String, CubeRow> byKey = rows.stream()
        .collect(Collectors.toMap(CubeRow::groupKey, Function.identity()));
    CubeRow usRow = byKey.get("geography:" + us.id());
    assertThat(usRow.totalValue()).isEqualByComparingTo("1200");
    assertThat(usRow.count()).isEqualTo(2);
    assertThat(usRow.average()).isEqualByComparingTo("600");
    assertThat(usRow.dimensions()).containsEntry(DimensionType.REGION, us.id());
    CubeRow unassigned = byKey.get("geography:unassigned");
    assertThat(unassigned.dimensions()).containsEntry(DimensionType.REGION, null);
    assertThat(unassigned.totalValue()).isEqualByComparingTo("40");
  }

  @Test
  void groupByPeriodAndDimension() {
    store.setValue(SCOPE, "opex", "2025-01", 1000, Map.of(DimensionType.REGION, us.id()));
    store.setValue(SCOPE, "opex", "2025-02", 300, Map.of(DimensionType.REGION, us.id()));
    store.setValue(SCOPE, "opex", "2025-02", 100, Map.of(DimensionType.REGION, eu.id()));

    List<CubeRow> rows = store.query(CubeQuery.builder(SCOPE, "opex")
        .groupBy(DimensionType.REGION)
        .groupByPeriod()
        .periods(List.of("2025-02"))
        .build());

    assertThat(rows).extracting(CubeRow::groupKey).containsExactlyInAnyOrder(
        "geography:" + us.id() + "|period:2025-02",
        "geography:" + eu.id() + "|period:2025-02");
    assertThat(rows).allSatisfy(row -> assertThat(row.period()).hasToString("2025-02"));
  }

  @Test
  void queryOverUnknownMetricIsEmpty() {
    assertThat(store.query(CubeQuery.builder(SCOPE, "nothing").period("2030-01").build()))
        .isEmpty();
  }

  @Test
  void queryValidatesFiltersAndGroupAxes() {
    assertThatThrownBy(() -> store.query(CubeQuery.builder(SCOPE, "opex")
        .filter(DimensionType.DEPARTMENT, us.id()).build()))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> store.query(CubeQuery.builder(SCOPE, "opex")
        .groupBy(DimensionType.SCENARIO).build()))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> store.query(CubeQuery.builder(SCOPE, "opex")
        .period("January").build()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void expiredDeadlineAbortsScan() {
    store.setValue(SCOPE, "opex", "2025-01", 1, Map.of());

    assertThatThrownBy(() -> store.query(CubeQuery.builder(SCOPE, "opex")
        .deadline(NOW.minusSeconds(1)).build()))
        .isInstanceOf(QueryDeadlineExceededException.class);
    assertThat(store.query(CubeQuery.builder(SCOPE, "opex")
        .deadline(NOW.plusSeconds(1)).build())).hasSize(1);
  }

  @Test
  void configuredTimeoutAppliesWhenCallerPassesNoDeadline() {
    MutableClock clock = new MutableClock(NOW);
    CubeProperties withTimeout = new CubeProperties("memory", List.of(DimensionType.DEPARTMENT),
        4, 1, true, Duration.ofSeconds(5), 1);
    InMemoryFactRepository facts = new InMemoryFactRepository() {
      @Override
      public List<Fact> findByMetric(String scopeId, String metricName) {
        clock.advance(Duration.ofSeconds(10));
        return super.findByMetric(scopeId, metricName);
      }
    };
    FactStore slow = new FactStore(facts, catalog, withTimeout, clock);
    slow.setValue(SCOPE, "opex", "2025-01", 1, Map.of());

    assertThatThrownBy(() -> slow.query(CubeQuery.builder(SCOPE, "opex").build()))
        .isInstanceOf(QueryDeadlineExceededException.class)
        .extracting(ex -> ((QueryDeadlineExceededException) ex).deadline())
        .isEqualTo(NOW.plusSeconds(5));
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
