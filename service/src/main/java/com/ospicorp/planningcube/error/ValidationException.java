package com.ospicorp.planningcube.error;

public class ValidationException extends CubeException {

  public ValidationException(String message, int errorCode) {
    super(message, errorCode);
  }

  public ValidationException(String message, int errorCode, Throwable cause) {
    super(message, errorCode, cause);
  }
}
