package com.ospicorp.planningcube.error;

import java.time.Instant;

public class QueryDeadlineExceededException extends CubeException {
  private final Instant deadline;

  public QueryDeadlineExceededException(Instant deadline, long scanned) {
    super("Query deadline " + deadline + " exceeded after scanning " + scanned + " facts",
        ErrorCodes.DEADLINE_EXCEEDED);
    this.deadline = deadline;
  }

  public Instant deadline() {
    return deadline;
  }
}
