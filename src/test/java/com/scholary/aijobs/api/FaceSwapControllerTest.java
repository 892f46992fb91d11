package com.scholary.aijobs.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.aijobs.auth.HeaderCallerAuthenticator;
import com.scholary.aijobs.auth.PermissionDeniedException;
import com.scholary.aijobs.faceswap.FaceSwapService;
import com.scholary.aijobs.faceswap.ListingNotFoundException;
import com.scholary.aijobs.faceswap.ListingPreconditionException;
import com.scholary.aijobs.prediction.LookupException;
import com.scholary.aijobs.prediction.NoOutputException;
import com.scholary.aijobs.prediction.PredictionFailedException;
import com.scholary.aijobs.prediction.PredictionStatus;
import com.scholary.aijobs.prediction.SubmissionException;
import com.scholary.aijobs.sync.JobTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Request handling and error mapping for the face-swap endpoint. */
@ExtendWith(MockitoExtension.class)
class FaceSwapControllerTest {

  private static final String BODY =
      "{\"listing_id\":\"l1\",\"image_url\":\"https://img/selfie.png\"}";

  @Mock private FaceSwapService faceSwapService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new FaceSwapController(faceSwapService, new HeaderCallerAuthenticator()))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  private ResultActions postAs(String userId, String body) throws Exception {
    return mockMvc.perform(
        post("/api/face-swap")
            .header(HeaderCallerAuthenticator.USER_ID_HEADER, userId)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
  }

  private void failWith(RuntimeException e) {
    when(faceSwapService.swapFace(eq("user-1"), any(FaceSwapRequest.class))).thenThrow(e);
  }

  @Test
  void testReturnsDisplayImageUrl() throws Exception {
    when(faceSwapService.swapFace(eq("user-1"), any(FaceSwapRequest.class)))
        .thenReturn("https://cdn/swapped.png");

    postAs("user-1", BODY)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.display_image_url").value("https://cdn/swapped.png"));
  }

  @Test
  void testUnauthenticated() throws Exception {
    mockMvc
        .perform(post("/api/face-swap").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("unauthenticated"));
    verifyNoInteractions(faceSwapService);
  }

  @Test
  void testMissingFieldIsInvalidArgument() throws Exception {
    postAs("user-1", "{\"listing_id\":\"l1\"}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid-argument"))
        .andExpect(jsonPath("$.message").value("`image_url` is required."));
    verifyNoInteractions(faceSwapService);
  }

  @Test
  void testNotFound() throws Exception {
    failWith(new ListingNotFoundException("l1"));

    postAs("user-1", BODY)
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("not-found"))
        .andExpect(jsonPath("$.message").value("Listing 'l1' not found."));
  }

  @Test
  void testPermissionDenied() throws Exception {
    failWith(new PermissionDeniedException("You can only apply face swap to your own listings."));

    postAs("user-1", BODY)
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("permission-denied"));
  }

  @Test
  void testFailedPrecondition() throws Exception {
    failWith(new ListingPreconditionException("no base image"));

    postAs("user-1", BODY)
        .andExpect(status().isPreconditionFailed())
        .andExpect(jsonPath("$.code").value("failed-precondition"));
  }

  @Test
  void testSubmissionFailureIsStartFailed() throws Exception {
    failWith(new SubmissionException("422 invalid version"));

    postAs("user-1", BODY)
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("start-failed"));
  }

  @Test
  void testModelFailureIsJobFailedWithProviderMessage() throws Exception {
    failWith(new PredictionFailedException("p1", PredictionStatus.FAILED, "OOM"));

    postAs("user-1", BODY)
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("job-failed"))
        .andExpect(jsonPath("$.message").value("OOM"));
  }

  @Test
  void testNoOutputIsJobFailed() throws Exception {
    failWith(new NoOutputException("p1"));

    postAs("user-1", BODY)
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("job-failed"));
  }

  @Test
  void testTimeoutIsDeadlineExceeded() throws Exception {
    failWith(new JobTimeoutException("p1", 20, Duration.ofSeconds(4), null));

    postAs("user-1", BODY)
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("deadline-exceeded"));
  }

  @Test
  void testLostProviderIsUnavailable() throws Exception {
    failWith(new LookupException("p1", "connection refused"));

    postAs("user-1", BODY)
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("provider-unavailable"));
  }

  @Test
  void testUnexpectedErrorIsInternal() throws Exception {
    failWith(new IllegalStateException("boom"));

    postAs("user-1", BODY)
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("internal"))
        .andExpect(jsonPath("$.message").value("An internal error occurred."));
  }
}
