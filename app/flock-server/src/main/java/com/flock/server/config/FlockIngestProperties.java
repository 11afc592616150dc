/*
 * Where: Flock configuration binding
 * What: Partition naming and category tag for persisted telemetry
 * Why: Keep the storage layout adjustable per environment
 */
package com.flock.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flock.ingest")
public record FlockIngestProperties(String partitionPrefix, String category) {

  public FlockIngestProperties {
    partitionPrefix =
        partitionPrefix == null || partitionPrefix.isBlank() ? "flock-" : partitionPrefix;
    category = category == null || category.isBlank() ? "osquery" : category;
  }
}
