package com.scholary.aijobs.faceswap;

import java.util.Optional;

/** Access to listing documents owned by the listings feature. */
public interface ListingStore {

  Optional<Listing> findById(String listingId);

  void save(Listing listing);

  /**
   * Point the listing's display image at a face-swap result and flag it as swapped.
   *
   * @throws ListingNotFoundException if the listing no longer exists
   */
  Listing updateDisplayImage(String listingId, String displayImageUrl);
}
