/*
 * Where: Flock API
 * What: POST /register for new agents
 * Why: The only unauthenticated write; it hands out the token used for HTTP Basic afterwards
 */
package com.flock.server.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.flock.server.api.request.RegisterRequest;
import com.flock.server.api.response.RegisterResponse;
import com.flock.server.service.InvalidRegistrationException;
import com.flock.server.service.RegistrationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class RegistrationController {

  private final RegistrationService registrationService;

  @PostMapping("/register")
  public RegisterResponse register(@RequestBody(required = false) JsonNode body) {
    // an empty object counts as no body at all
    if (body == null || !body.isObject() || body.isEmpty()) {
      throw new InvalidRegistrationException(ApiErrorResponse.INVALID_JSON);
    }
    final RegisterRequest request = RegisterRequest.from(body);
    return RegisterResponse.of(registrationService.register(request.username(), request.name()));
  }
}
