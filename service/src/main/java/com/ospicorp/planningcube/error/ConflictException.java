package com.ospicorp.planningcube.error;

public class ConflictException extends CubeException {

  public ConflictException(String message, int errorCode) {
    super(message, errorCode);
  }
}
