package com.flock.server.service;

import com.flock.server.model.NotificationTypeConfig;
import com.flock.server.repository.NotificationTypeRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JdbcNotificationTypeConfigStore implements NotificationTypeConfigStore {

  private static final Logger logger =
      LoggerFactory.getLogger(JdbcNotificationTypeConfigStore.class);

  private final NotificationTypeRepository notificationTypeRepository;
  private final Clock clock;

  @Override
  public Optional<NotificationTypeConfig> get(String kind) {
    return notificationTypeRepository.findByKind(kind);
  }

  @Override
  public List<NotificationTypeConfig> all() {
    return notificationTypeRepository.findAll();
  }

  @Override
  public NotificationTypeConfig setEnabled(String kind, boolean enabled) {
    final NotificationTypeConfig updated =
        notificationTypeRepository
            .updateEnabled(kind, enabled, Instant.now(clock))
            .orElseThrow(() -> new UnknownNotificationTypeException(kind));
    logger.info("notification type toggled kind={} enabled={}", kind, enabled);
    return updated;
  }
}
