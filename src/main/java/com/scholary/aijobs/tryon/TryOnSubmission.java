package com.scholary.aijobs.tryon;

/** A try-on job that was accepted and is now waiting for its webhook. */
public record TryOnSubmission(String jobId, String predictionId) {}
