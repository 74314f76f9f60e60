package com.ospicorp.planningcube.error;

public class NotFoundException extends CubeException {

  public NotFoundException(String message, int errorCode) {
    super(message, errorCode);
  }
}
