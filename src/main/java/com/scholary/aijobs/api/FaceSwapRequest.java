package com.scholary.aijobs.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to swap the caller's face onto one of their listings.
 *
 * @param listingId the listing to update
 * @param imageUrl the caller's selfie, used as the face donor
 */
public record FaceSwapRequest(
    @JsonProperty("listing_id") @NotBlank(message = "`listing_id` is required.")
        String listingId,
    @JsonProperty("image_url") @NotBlank(message = "`image_url` is required.") String imageUrl) {}
