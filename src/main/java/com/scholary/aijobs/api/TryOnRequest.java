package com.scholary.aijobs.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a virtual try-on.
 *
 * @param fcmToken device token the result notification is pushed to
 */
public record TryOnRequest(
    @JsonProperty("user_image_url") @NotBlank(message = "`user_image_url` is required.")
        String userImageUrl,
    @JsonProperty("garment_image_url") @NotBlank(message = "`garment_image_url` is required.")
        String garmentImageUrl,
    @JsonProperty("garment_description")
        @NotBlank(message = "`garment_description` is required.")
        String garmentDescription,
    @JsonProperty("fcm_token") @NotBlank(message = "`fcm_token` is required.")
        String fcmToken) {}
