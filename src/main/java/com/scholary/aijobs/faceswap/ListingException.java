package com.scholary.aijobs.faceswap;

/** Base exception for listing lookups and state checks. */
public class ListingException extends RuntimeException {

  public ListingException(String message) {
    super(message);
  }
}
