package com.scholary.aijobs.auth;

/** The caller is authenticated but does not own the resource it is acting on. */
public class PermissionDeniedException extends RuntimeException {

  public PermissionDeniedException(String message) {
    super(message);
  }
}
