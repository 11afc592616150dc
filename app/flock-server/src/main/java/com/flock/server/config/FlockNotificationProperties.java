/*
 * Where: Flock configuration binding
 * What: Catalog of notification kinds with their seed enablement and message templates
 * Why: New kinds are added in configuration without touching the classifier or dispatcher
 */
package com.flock.server.config;

import com.flock.server.model.NotificationCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "flock.notifications")
@Validated
public record FlockNotificationProperties(
    @NotEmpty List<@Valid CatalogEntry> catalog, String defaultSummaryTemplate) {

  public FlockNotificationProperties {
    // SpotBugs EI_EXPOSE_REP: keep an unmodifiable copy of the bound list
    catalog = catalog == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(catalog));
    defaultSummaryTemplate =
        defaultSummaryTemplate == null || defaultSummaryTemplate.isBlank()
            ? "{name} ({username}): {added_count} added, {removed_count} removed,"
                + " {other_count} other {kind} changes"
            : defaultSummaryTemplate;
  }

  public Optional<CatalogEntry> find(String kind) {
    return catalog.stream().filter(entry -> entry.kind().equals(kind)).findFirst();
  }

  public record CatalogEntry(
      @NotBlank String kind,
      @NotNull NotificationCategory category,
      boolean enabled,
      String template,
      String summaryTemplate) {}
}
