/*
 * Where: Flock API
 * What: Authenticated agent endpoints: ping, telemetry submission and flock log submission
 * Why: The submitter identity comes from the authenticated principal, never from the body
 */
package com.flock.server.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.flock.server.api.response.PingResponse;
import com.flock.server.api.response.ProcessedResponse;
import com.flock.server.service.SubmissionService;
import java.security.Principal;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SubmissionController {

  private final SubmissionService submissionService;

  @GetMapping("/ping")
  public PingResponse ping() {
    return PingResponse.ok();
  }

  @PostMapping("/submit")
  public ProcessedResponse submit(
      @RequestBody(required = false) JsonNode body, Principal principal) {
    return ProcessedResponse.of(submissionService.submitTelemetry(body, principal.getName()));
  }

  @PostMapping("/submit_flock_logs")
  public ProcessedResponse submitFlockLogs(
      @RequestBody(required = false) JsonNode body, Principal principal) {
    return ProcessedResponse.of(submissionService.submitFlockLogs(body, principal.getName()));
  }
}
