package com.scholary.aijobs.faceswap;

import java.time.Instant;

/**
 * The listing document as far as the face-swap workflow is concerned.
 *
 * @param lenderId the owning user
 * @param imageUrl base photo the face is swapped onto
 * @param displayImageUrl photo shown to other users, the swap result once there is one
 */
public record Listing(
    String id,
    String lenderId,
    String imageUrl,
    String displayImageUrl,
    boolean faceSwapped,
    Instant updatedAt) {

  Listing withDisplayImage(String newDisplayImageUrl, Instant now) {
    return new Listing(id, lenderId, imageUrl, newDisplayImageUrl, true, now);
  }
}
