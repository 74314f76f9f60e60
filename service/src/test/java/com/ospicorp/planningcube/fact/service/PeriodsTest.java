package com.ospicorp.planningcube.fact.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.ValidationException;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PeriodsTest {

  @Test
  void parsesMonthTokens() {
    assertThat(Periods.parse("2025-01")).isEqualTo(YearMonth.of(2025, 1));
    assertThat(Periods.parse(" 2024-12 ")).isEqualTo(YearMonth.of(2024, 12));
  }

  @ParameterizedTest
  @ValueSource(strings = {"2025-13", "2025-00", "2025-1", "25-01", "2025/01", "2025-01-31", ""})
  void rejectsMalformedTokens(String token) {
    assertThatThrownBy(() -> Periods.parse(token))
        .isInstanceOf(ValidationException.class)
        .extracting(ex -> ((ValidationException) ex).errorCode())
        .isEqualTo(ErrorCodes.MALFORMED_PERIOD);
  }

  @Test
  void parseAllTreatsMissingFilterAsAllPeriods() {
    assertThat(Periods.parseAll(null)).isEmpty();
    assertThat(Periods.parseAll(List.of())).isEmpty();
    assertThat(Periods.parseAll(Arrays.asList("2025-02", "2025-01", "2025-02")))
        .containsExactly(YearMonth.of(2025, 2), YearMonth.of(2025, 1));
  }
}
