package com.scholary.aijobs.faceswap;

import com.scholary.aijobs.api.FaceSwapRequest;
import com.scholary.aijobs.auth.PermissionDeniedException;
import com.scholary.aijobs.prediction.ReplicateProperties;
import com.scholary.aijobs.sync.SyncJobRunner;
import com.scholary.aijobs.sync.SyncOutcome;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Swaps the caller's face onto their own listing photo, synchronously.
 *
 * <p>Flow: check the caller owns the listing and it has a base image, run the face-swap model
 * through {@link SyncJobRunner}, then write the result back to the listing. The write-back is the
 * last step, so a failed or timed-out prediction leaves the listing untouched.
 */
@Service
public class FaceSwapService {

  private static final Logger LOGGER = LoggerFactory.getLogger(FaceSwapService.class);

  private final ListingStore listingStore;
  private final SyncJobRunner syncJobRunner;
  private final String modelVersion;

  public FaceSwapService(
      ListingStore listingStore, SyncJobRunner syncJobRunner, ReplicateProperties properties) {
    this.listingStore = listingStore;
    this.syncJobRunner = syncJobRunner;
    this.modelVersion = properties.models().faceSwap();
  }

  /**
   * Run the face swap and return the new display image URL.
   *
   * @throws ListingNotFoundException if the listing does not exist
   * @throws PermissionDeniedException if the caller is not the listing's lender
   * @throws ListingPreconditionException if the listing has no base image
   */
  public String swapFace(String callerId, FaceSwapRequest request) {
    Listing listing =
        listingStore
            .findById(request.listingId())
            .orElseThrow(() -> new ListingNotFoundException(request.listingId()));

    if (!callerId.equals(listing.lenderId())) {
      throw new PermissionDeniedException("You can only apply face swap to your own listings.");
    }
    if (listing.imageUrl() == null || listing.imageUrl().isBlank()) {
      throw new ListingPreconditionException(
          "The listing does not have a base image to swap onto.");
    }

    Map<String, Object> input = new LinkedHashMap<>();
    // source_image is the face donor, target_image receives the face
    input.put("source_image", request.imageUrl());
    input.put("target_image", listing.imageUrl());

    SyncOutcome outcome = syncJobRunner.run(modelVersion, input);

    listingStore.updateDisplayImage(listing.id(), outcome.outputUrl());
    LOGGER.info(
        "Listing {} updated for user {}: prediction={}, polls={}",
        listing.id(),
        callerId,
        outcome.predictionId(),
        outcome.pollAttempts());

    return outcome.outputUrl();
  }
}
