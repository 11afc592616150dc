/*
 * Where: Flock service layer
 * What: Decides whether a username/token pair belongs to a registered principal
 * Why: Every agent call is authenticated against the principals table
 */
package com.flock.server.service;

import com.flock.server.repository.PrincipalRepository;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CredentialGate {

  private static final Logger logger = LoggerFactory.getLogger(CredentialGate.class);

  private final PrincipalRepository principalRepository;

  /** Fails closed: lookup errors deny access instead of propagating. */
  public boolean authenticate(String username, String secret) {
    if (username == null || username.isBlank() || secret == null) {
      return false;
    }
    try {
      return principalRepository
          .findByUsername(username)
          .map(principal -> tokensMatch(principal.token(), secret))
          .orElse(false);
    } catch (DataAccessException ex) {
      logger.warn("credential lookup failed; denying username={}", username, ex);
      return false;
    }
  }

  private boolean tokensMatch(String stored, String supplied) {
    if (stored == null) {
      return false;
    }
    return MessageDigest.isEqual(
        stored.getBytes(StandardCharsets.UTF_8), supplied.getBytes(StandardCharsets.UTF_8));
  }
}
