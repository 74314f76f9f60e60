package com.ospicorp.planningcube.error;

public final class ErrorCodes {
  public static final int MISSING_FIELD = 2001;
  public static final int MALFORMED_PERIOD = 2002;
  public static final int INVALID_AMOUNT = 2003;
  public static final int HIERARCHY_CYCLE = 2004;
  public static final int INVALID_PARENT = 2005;

  public static final int UNKNOWN_DIMENSION = 3001;
  public static final int UNKNOWN_MEMBER = 3002;
  public static final int UNKNOWN_METRIC = 3003;
  public static final int UNKNOWN_DIMENSION_TYPE = 3004;

  public static final int DUPLICATE_CODE = 4001;
  public static final int DUPLICATE_NAME = 4002;
  public static final int MEMBER_IN_USE = 4003;

  public static final int DEADLINE_EXCEEDED = 5001;

  private ErrorCodes() {
  }
}
