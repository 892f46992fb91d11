package com.scholary.aijobs.api;

/**
 * Error body for every failed request.
 *
 * @param code stable machine-readable error code, e.g. {@code not-found}
 * @param message human-readable explanation
 */
public record ErrorResponse(String code, String message) {}
