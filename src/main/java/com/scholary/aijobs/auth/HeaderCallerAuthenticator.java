package com.scholary.aijobs.auth;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the caller id from a header set by the API gateway after it has verified the user's
 * token. Never expose this service directly to clients.
 */
@Component
public class HeaderCallerAuthenticator implements CallerAuthenticator {

  public static final String USER_ID_HEADER = "X-User-Id";

  @Override
  public String requireCaller(HttpServletRequest request) {
    String userId = request.getHeader(USER_ID_HEADER);
    if (userId == null || userId.isBlank()) {
      throw new UnauthenticatedException("You must be signed in to use this feature.");
    }
    return userId.trim();
  }
}
