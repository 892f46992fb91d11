package com.scholary.aijobs.faceswap;

/** The listing exists but is not in a state the face swap can work with. */
public class ListingPreconditionException extends ListingException {

  public ListingPreconditionException(String message) {
    super(message);
  }
}
