package com.ospicorp.planningcube.error;

/**
 * Base type for failures classified by the cube engine. The calling layer decides how a
 * failure is rendered; the engine only carries a stable numeric code next to the message.
 */
public abstract class CubeException extends RuntimeException {
  private final int errorCode;

  protected CubeException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  protected CubeException(String message, int errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }
}
