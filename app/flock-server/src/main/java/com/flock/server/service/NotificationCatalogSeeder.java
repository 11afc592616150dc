/*
 * Where: Flock startup
 * What: Seeds notification_types from the configured catalog
 * Why: Kinds must exist before the first dispatch; existing toggles are preserved
 */
package com.flock.server.service;

import com.flock.server.config.FlockNotificationProperties;
import com.flock.server.model.NotificationTypeConfig;
import com.flock.server.repository.NotificationTypeRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "flock.notifications.seed-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationCatalogSeeder implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(NotificationCatalogSeeder.class);

  private final NotificationTypeRepository notificationTypeRepository;
  private final FlockNotificationProperties properties;
  private final Clock clock;

  @Override
  public void run(ApplicationArguments args) {
    seed();
  }

  public int seed() {
    final Instant now = Instant.now(clock);
    int inserted = 0;
    for (FlockNotificationProperties.CatalogEntry entry : properties.catalog()) {
      inserted +=
          notificationTypeRepository.insertIfAbsent(
              new NotificationTypeConfig(entry.kind(), entry.category(), entry.enabled()), now);
    }
    logger.info(
        "notification catalog seeded inserted={} configured={}",
        inserted,
        properties.catalog().size());
    return inserted;
  }
}
