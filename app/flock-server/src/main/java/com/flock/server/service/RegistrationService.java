/*
 * Where: Flock service layer
 * What: Registers a new agent principal and hands out its auth token
 * Why: The token issued here is the secret every later agent call is checked against
 */
package com.flock.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flock.server.model.NotificationCatalog;
import com.flock.server.model.NotificationEvent;
import com.flock.server.model.Principal;
import com.flock.server.repository.PrincipalRepository;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.io.BaseEncoding;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

  static final String KIND_USER_REGISTERED = "user_registered";
  static final String KIND_USER_ALREADY_EXISTS = "user_already_exists";
  static final String MISSING_USERNAME = "You must provide a username";
  static final String INVALID_USERNAME =
      "Usernames must only contain letters, numbers, '-', or '_'";

  private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9_-]+");
  private static final CharMatcher STRIPPED_NAME_CHARS = CharMatcher.anyOf("`{}!@#$%^&*_");
  private static final int TOKEN_BYTES = 16;
  private static final SecureRandom RANDOM = new SecureRandom();

  private final PrincipalRepository principalRepository;
  private final NotificationTypeConfigStore configStore;
  private final NotificationDispatcher dispatcher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Registers {@code username} and returns its new token.
   *
   * <p>A taken username keeps its original token; the attempt is announced as {@code
   * user_already_exists} and rejected with {@link DuplicateRegistrationException}.
   */
  public String register(String username, String name) {
    if (username == null || username.isEmpty()) {
      throw new InvalidRegistrationException(MISSING_USERNAME);
    }
    if (!USERNAME.matcher(username).matches()) {
      throw new InvalidRegistrationException(INVALID_USERNAME);
    }
    final String displayName = sanitizeName(name);
    final Principal principal =
        new Principal(username, displayName, newToken(), Instant.now(clock));

    if (principalRepository.insertIfAbsent(principal) == 0) {
      logger.info("registration rejected; username already taken username={}", username);
      announce(KIND_USER_ALREADY_EXISTS, username, displayName);
      throw new DuplicateRegistrationException(username);
    }
    logger.info("principal registered username={}", username);
    announce(KIND_USER_REGISTERED, username, displayName);
    return principal.token();
  }

  @VisibleForTesting
  static String sanitizeName(String name) {
    return name == null ? "" : STRIPPED_NAME_CHARS.removeFrom(name);
  }

  @VisibleForTesting
  static String newToken() {
    final byte[] bytes = new byte[TOKEN_BYTES];
    RANDOM.nextBytes(bytes);
    return BaseEncoding.base16().lowerCase().encode(bytes);
  }

  private void announce(String kind, String username, String displayName) {
    final NotificationCatalog catalog;
    try {
      catalog = configStore.snapshot();
    } catch (DataAccessException ex) {
      logger.warn("notification config unavailable; {} not announced", kind, ex);
      return;
    }
    final ObjectNode payload = objectMapper.createObjectNode();
    payload.put("username", username);
    payload.put("name", displayName);
    dispatcher.dispatch(new NotificationEvent(kind, payload), catalog);
  }
}
