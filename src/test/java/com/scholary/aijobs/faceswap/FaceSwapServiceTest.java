package com.scholary.aijobs.faceswap;

import static com.scholary.aijobs.prediction.PredictionFixtures.failed;
import static com.scholary.aijobs.prediction.PredictionFixtures.processing;
import static com.scholary.aijobs.prediction.PredictionFixtures.starting;
import static com.scholary.aijobs.prediction.PredictionFixtures.succeeded;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.aijobs.api.FaceSwapRequest;
import com.scholary.aijobs.auth.PermissionDeniedException;
import com.scholary.aijobs.config.JobsProperties;
import com.scholary.aijobs.job.MutableClock;
import com.scholary.aijobs.prediction.PredictionFailedException;
import com.scholary.aijobs.prediction.PredictionResolver;
import com.scholary.aijobs.prediction.ReplicateProperties;
import com.scholary.aijobs.prediction.ScriptedPredictionGateway;
import com.scholary.aijobs.sync.JobTimeoutException;
import com.scholary.aijobs.sync.SyncJobRunner;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FaceSwapServiceTest {

  private static final Instant CREATED = Instant.parse("2024-04-01T08:00:00Z");
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private ScriptedPredictionGateway gateway;
  private InMemoryListingStore listingStore;
  private FaceSwapService service;

  @BeforeEach
  void setUp() {
    gateway = new ScriptedPredictionGateway();
    listingStore = new InMemoryListingStore(100, new MutableClock(NOW));
    JobsProperties jobsProperties =
        new JobsProperties(
            null,
            new JobsProperties.SyncProperties(Duration.ZERO, 3, 3),
            new JobsProperties.ReconcileProperties(
                false, Duration.ofMinutes(1), Duration.ofMinutes(10), Duration.ofHours(24), 50));
    ReplicateProperties replicateProperties =
        new ReplicateProperties(
            "https://api.replicate.com",
            "token",
            5,
            5,
            null,
            new ReplicateProperties.Models("face-version", "tryon-version"));
    SyncJobRunner runner =
        new SyncJobRunner(gateway, new PredictionResolver(gateway), jobsProperties);
    service = new FaceSwapService(listingStore, runner, replicateProperties);

    listingStore.save(
        new Listing(
            "l1",
            "lender-1",
            "https://img/listing.png",
            "https://img/listing.png",
            false,
            CREATED));
  }

  @Test
  void testSwapUpdatesListingDisplayImage() {
    gateway
        .onSubmit(starting("p1"))
        .onFetch(processing("p1"), succeeded("p1", "https://cdn/swapped.png"));

    String url =
        service.swapFace("lender-1", new FaceSwapRequest("l1", "https://img/selfie.png"));

    assertThat(url).isEqualTo("https://cdn/swapped.png");
    Listing listing = listingStore.findById("l1").orElseThrow();
    assertThat(listing.displayImageUrl()).isEqualTo("https://cdn/swapped.png");
    assertThat(listing.faceSwapped()).isTrue();
    assertThat(listing.updatedAt()).isEqualTo(NOW);
    assertThat(listing.imageUrl()).isEqualTo("https://img/listing.png");

    ScriptedPredictionGateway.Submission submission = gateway.submissions().get(0);
    assertThat(submission.modelVersion()).isEqualTo("face-version");
    assertThat(submission.input())
        .containsEntry("source_image", "https://img/selfie.png")
        .containsEntry("target_image", "https://img/listing.png");
    assertThat(submission.callbackUrl()).isNull();
  }

  @Test
  void testUnknownListing() {
    assertThatThrownBy(() -> service.swapFace("lender-1", new FaceSwapRequest("nope", "x")))
        .isInstanceOf(ListingNotFoundException.class)
        .hasMessage("Listing 'nope' not found.");
    assertThat(gateway.submissions()).isEmpty();
  }

  @Test
  void testOnlyLenderMaySwap() {
    assertThatThrownBy(() -> service.swapFace("someone-else", new FaceSwapRequest("l1", "x")))
        .isInstanceOf(PermissionDeniedException.class);
    assertThat(gateway.submissions()).isEmpty();
  }

  @Test
  void testListingWithoutBaseImage() {
    listingStore.save(new Listing("l2", "lender-1", null, null, false, CREATED));

    assertThatThrownBy(() -> service.swapFace("lender-1", new FaceSwapRequest("l2", "x")))
        .isInstanceOf(ListingPreconditionException.class);
  }

  @Test
  void testFailedModelLeavesListingUntouched() {
    gateway.onSubmit(starting("p1")).onFetch(failed("p1", "face not detected"));

    assertThatThrownBy(() -> service.swapFace("lender-1", new FaceSwapRequest("l1", "x")))
        .isInstanceOf(PredictionFailedException.class)
        .hasMessage("face not detected");

    Listing listing = listingStore.findById("l1").orElseThrow();
    assertThat(listing.faceSwapped()).isFalse();
    assertThat(listing.updatedAt()).isEqualTo(CREATED);
  }

  @Test
  void testTimeoutLeavesListingUntouched() {
    gateway.onSubmit(starting("p1")).onAnyFetch(processing("p1"));

    assertThatThrownBy(() -> service.swapFace("lender-1", new FaceSwapRequest("l1", "x")))
        .isInstanceOf(JobTimeoutException.class);
    assertThat(gateway.fetchCount()).isEqualTo(3);
    assertThat(listingStore.findById("l1").orElseThrow().faceSwapped()).isFalse();
  }
}
