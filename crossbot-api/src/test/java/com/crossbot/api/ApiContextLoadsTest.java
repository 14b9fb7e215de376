package com.crossbot.api;

import com.crossbot.application.service.BotController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Minimal smoke test.
 * If this fails, the service is not starting with an empty config directory.
 */
@SpringBootTest(properties = {"spring.profiles.active=test"})
class ApiContextLoadsTest {

  @Autowired BotController bot;

  @Test
  void contextLoadsWithDefaultSettings() {
    assertThat(bot.settings().symbol()).isEqualTo("BTCUSDT");
    assertThat(bot.status().running()).isFalse();
  }
}
