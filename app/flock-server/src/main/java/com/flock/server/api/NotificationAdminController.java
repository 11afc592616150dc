/*
 * Where: Flock admin API
 * What: Lists notification kinds and toggles their enablement
 * Why: Operators silence noisy kinds at runtime; the next submission sees the change
 */
package com.flock.server.api;

import com.flock.server.api.request.NotificationToggleRequest;
import com.flock.server.api.response.NotificationTypeResponse;
import com.flock.server.api.response.NotificationTypesResponse;
import com.flock.server.service.NotificationTypeConfigStore;
import com.flock.server.service.UnknownNotificationTypeException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

  private final NotificationTypeConfigStore configStore;

  @GetMapping
  public NotificationTypesResponse list() {
    return new NotificationTypesResponse(
        configStore.all().stream().map(NotificationTypeResponse::from).toList());
  }

  @GetMapping("/{kind}")
  public NotificationTypeResponse get(@PathVariable("kind") String kind) {
    return configStore
        .get(kind)
        .map(NotificationTypeResponse::from)
        .orElseThrow(() -> new UnknownNotificationTypeException(kind));
  }

  @PutMapping("/{kind}")
  public NotificationTypeResponse toggle(
      @PathVariable("kind") String kind, @Valid @RequestBody NotificationToggleRequest request) {
    return NotificationTypeResponse.from(configStore.setEnabled(kind, request.enabled()));
  }
}
