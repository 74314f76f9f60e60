package com.ospicorp.planningcube.fact.service;

import com.ospicorp.planningcube.error.QueryDeadlineExceededException;
import java.time.Clock;
import java.time.Instant;

/** Checks the clock every {@code interval} scanned facts; a null deadline never expires. */
final class DeadlineGuard {
  private final Instant deadline;
  private final Clock clock;
  private final int interval;
  private long scanned;

  DeadlineGuard(Instant deadline, Clock clock, int interval) {
    this.deadline = deadline;
    this.clock = clock;
    this.interval = Math.max(1, interval);
  }

  void check() {
    if (deadline != null && clock.instant().isAfter(deadline)) {
      throw new QueryDeadlineExceededException(deadline, scanned);
    }
  }

  void tick() {
    scanned++;
    if (scanned % interval == 0) {
      check();
    }
  }
}
