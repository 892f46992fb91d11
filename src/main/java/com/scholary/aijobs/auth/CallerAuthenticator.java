package com.scholary.aijobs.auth;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Pass/fail authentication guard for end-user requests.
 *
 * <p>Token verification itself belongs to the identity provider; implementations only report who
 * the caller is.
 */
public interface CallerAuthenticator {

  /**
   * Resolve the authenticated caller's user id.
   *
   * @throws UnauthenticatedException if the request carries no authenticated identity
   */
  String requireCaller(HttpServletRequest request);
}
