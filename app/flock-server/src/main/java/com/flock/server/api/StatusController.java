/*
 * Where: Flock API
 * What: Unauthenticated liveness line at the root path
 * Why: Agents and operators check reachability before configuring credentials
 */
package com.flock.server.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "flock: ok";
  }
}
