package com.scholary.aijobs.prediction;

/** The provider rejected a new prediction or could not be reached at submit time. */
public class SubmissionException extends PredictionException {

  public SubmissionException(String message) {
    super(message);
  }

  public SubmissionException(String message, Throwable cause) {
    super(message, null, cause);
  }
}
