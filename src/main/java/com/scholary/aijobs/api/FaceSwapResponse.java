package com.scholary.aijobs.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The listing's new display image. */
public record FaceSwapResponse(@JsonProperty("display_image_url") String displayImageUrl) {}
