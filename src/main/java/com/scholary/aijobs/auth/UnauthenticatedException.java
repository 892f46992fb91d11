package com.scholary.aijobs.auth;

/** The request has no authenticated caller. */
public class UnauthenticatedException extends RuntimeException {

  public UnauthenticatedException(String message) {
    super(message);
  }
}
