package com.scholary.aijobs.sync;

/**
 * Result of a prediction driven to completion by {@link SyncJobRunner}.
 *
 * <p>Only lives for the duration of the originating request.
 */
public record SyncOutcome(String predictionId, String outputUrl, int pollAttempts) {}
