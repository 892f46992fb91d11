package com.scholary.aijobs.api;

import com.scholary.aijobs.auth.CallerAuthenticator;
import com.scholary.aijobs.faceswap.FaceSwapService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous face swap.
 *
 * <p>The request blocks while the model runs, typically well under the poll budget.
 */
@RestController
@Tag(name = "Face swap", description = "Swap the lender's face onto their listing photo")
public class FaceSwapController {

  private static final Logger LOGGER = LoggerFactory.getLogger(FaceSwapController.class);

  private final FaceSwapService faceSwapService;
  private final CallerAuthenticator callerAuthenticator;

  public FaceSwapController(
      FaceSwapService faceSwapService, CallerAuthenticator callerAuthenticator) {
    this.faceSwapService = faceSwapService;
    this.callerAuthenticator = callerAuthenticator;
  }

  @PostMapping("/api/face-swap")
  @Operation(
      summary = "Run face swap",
      description = "Swap the caller's face onto their listing and return the new display image")
  public ResponseEntity<FaceSwapResponse> faceSwap(
      HttpServletRequest httpRequest, @Valid @RequestBody FaceSwapRequest request) {
    String callerId = callerAuthenticator.requireCaller(httpRequest);
    LOGGER.info("Face swap request: listing={}, user={}", request.listingId(), callerId);

    String displayImageUrl = faceSwapService.swapFace(callerId, request);
    return ResponseEntity.ok(new FaceSwapResponse(displayImageUrl));
  }
}
