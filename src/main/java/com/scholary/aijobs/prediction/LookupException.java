package com.scholary.aijobs.prediction;

/** Reading a prediction's status failed. Usually transient. */
public class LookupException extends PredictionException {

  public LookupException(String predictionId, String message) {
    super(message, predictionId, null);
  }

  public LookupException(String predictionId, String message, Throwable cause) {
    super(message, predictionId, cause);
  }
}
