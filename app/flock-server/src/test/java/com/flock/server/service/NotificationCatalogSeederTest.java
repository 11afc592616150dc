package com.flock.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flock.server.config.FlockNotificationProperties;
import com.flock.server.config.FlockNotificationProperties.CatalogEntry;
import com.flock.server.model.NotificationCategory;
import com.flock.server.model.NotificationTypeConfig;
import com.flock.server.repository.NotificationTypeRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationCatalogSeederTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-02-01T00:00:00Z");

  @Mock private NotificationTypeRepository notificationTypeRepository;

  @Test
  void insertsConfiguredKindsWithoutOverwriting() {
    final FlockNotificationProperties properties =
        new FlockNotificationProperties(
            List.of(
                new CatalogEntry("launchd", NotificationCategory.OSQUERY, true, "t", null),
                new CatalogEntry("user_registered", NotificationCategory.SYSTEM, false, "t", null)),
            null);
    when(notificationTypeRepository.insertIfAbsent(any(), eq(FIXED_NOW))).thenReturn(1, 0);
    final NotificationCatalogSeeder seeder =
        new NotificationCatalogSeeder(
            notificationTypeRepository, properties, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

    assertThat(seeder.seed()).isEqualTo(1);

    verify(notificationTypeRepository)
        .insertIfAbsent(
            new NotificationTypeConfig("launchd", NotificationCategory.OSQUERY, true), FIXED_NOW);
    verify(notificationTypeRepository)
        .insertIfAbsent(
            new NotificationTypeConfig("user_registered", NotificationCategory.SYSTEM, false),
            FIXED_NOW);
  }
}
