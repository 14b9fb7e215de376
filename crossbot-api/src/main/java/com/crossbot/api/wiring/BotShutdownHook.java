package com.crossbot.api.wiring;

import com.crossbot.application.service.BotController;
import com.crossbot.application.service.StopResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

/**
 * Stops the live worker before the scheduler pool is torn down.
 */
@Component
public class BotShutdownHook {

  private static final Logger log = LoggerFactory.getLogger(BotShutdownHook.class);

  private final BotController bot;

  public BotShutdownHook(BotController bot) {
    this.bot = bot;
  }

  @PreDestroy
  public void onShutdown() {
    try {
      StopResult res = bot.stop();
      if (res != StopResult.ALREADY_IDLE) {
        log.info("[BOT] stopped on shutdown: {}", res);
      }
    } catch (RuntimeException e) {
      log.warn("[BOT] shutdown stop failed", e);
    }
  }
}
