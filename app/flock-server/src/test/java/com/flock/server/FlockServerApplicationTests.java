package com.flock.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.flock.server.service.ChatChannelSender;
import com.flock.server.service.LocalChatChannelSender;
import com.flock.server.service.NotificationTypeConfigStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class FlockServerApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ChatChannelSender chatChannelSender;
  @Autowired private NotificationTypeConfigStore configStore;

  @Test
  void contextLoadsWithSeededCatalogAndLocalChatSender() {
    assertThat(chatChannelSender).isInstanceOf(LocalChatChannelSender.class);
    assertThat(configStore.get("user_registered")).isPresent();
    assertThat(configStore.get("launchd")).isPresent();
  }
}
