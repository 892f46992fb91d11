package com.scholary.aijobs.prediction;

import static com.scholary.aijobs.prediction.PredictionFixtures.prediction;
import static com.scholary.aijobs.prediction.PredictionFixtures.succeeded;
import static com.scholary.aijobs.prediction.PredictionFixtures.succeededWithScalar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

/** Tests for output extraction shared by every gateway. */
class PredictionGatewayTest {

  private final PredictionGateway gateway = new ScriptedPredictionGateway();

  @Test
  void testScalarOutputIsReturnedAsIs() {
    assertThat(gateway.extractResult(succeededWithScalar("p1", "https://cdn/out.png")))
        .isEqualTo("https://cdn/out.png");
  }

  @Test
  void testListOutputYieldsFirstElement() {
    assertThat(gateway.extractResult(succeeded("p1", "https://cdn/a.png", "https://cdn/b.png")))
        .isEqualTo("https://cdn/a.png");
  }

  @Test
  void testEmptyListHasNoOutput() {
    assertThatThrownBy(() -> gateway.extractResult(succeeded("p1")))
        .isInstanceOf(NoOutputException.class)
        .satisfies(e -> assertThat(((NoOutputException) e).getPredictionId()).isEqualTo("p1"));
  }

  @Test
  void testMissingOutputHasNoOutput() {
    assertThatThrownBy(
            () -> gateway.extractResult(prediction("p1", PredictionStatus.SUCCEEDED, null, null)))
        .isInstanceOf(NoOutputException.class);
  }

  @Test
  void testBlankOrNonTextOutputHasNoOutput() {
    assertThatThrownBy(() -> gateway.extractResult(succeededWithScalar("p1", "  ")))
        .isInstanceOf(NoOutputException.class);
    assertThatThrownBy(
            () ->
                gateway.extractResult(
                    prediction(
                        "p1",
                        PredictionStatus.SUCCEEDED,
                        JsonNodeFactory.instance.numberNode(3),
                        null)))
        .isInstanceOf(NoOutputException.class);
  }
}
