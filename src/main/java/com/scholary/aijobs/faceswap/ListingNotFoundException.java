package com.scholary.aijobs.faceswap;

/** The listing does not exist. */
public class ListingNotFoundException extends ListingException {

  public ListingNotFoundException(String listingId) {
    super(String.format("Listing '%s' not found.", listingId));
  }
}
