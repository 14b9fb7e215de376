package com.crossbot.api.bot;

import com.crossbot.application.lifecycle.BotState;
import com.crossbot.application.lifecycle.InvalidStateTransitionException;
import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.service.BotController;
import com.crossbot.application.service.StartResult;
import com.crossbot.application.service.StopResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class BotApiController {

  private static final Logger log = LoggerFactory.getLogger(BotApiController.class);

  private final BotController bot;

  public BotApiController(BotController bot) {
    this.bot = bot;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of("message", "TradingBot API running");
  }

  @GetMapping("/status")
  public StatusResponse status() {
    return StatusResponse.from(bot.status());
  }

  @PostMapping("/start")
  public Map<String, Object> start() {
    StartResult res = bot.start();
    if (res == StartResult.ALREADY_RUNNING) {
      throw new InvalidStateTransitionException("Bot already running", BotState.RUNNING);
    }
    if (res == StartResult.STILL_STOPPING) {
      throw new InvalidStateTransitionException("Bot still stopping", BotState.IDLE);
    }
    log.info("[BOT_HTTP] action=START symbol={}", bot.settings().symbol());
    return Map.of("message", "Bot started");
  }

  @PostMapping("/stop")
  public Map<String, Object> stop() {
    StopResult res = bot.stop();
    if (res == StopResult.ALREADY_IDLE) {
      throw new InvalidStateTransitionException("Bot not running", BotState.IDLE);
    }
    log.info("[BOT_HTTP] action=STOP result={}", res);
    return Map.of("message", res == StopResult.FORCED ? "Bot stopped (forced)" : "Bot stopped");
  }

  @PostMapping("/backtest")
  public BacktestResponse backtest(@Valid @RequestBody(required = false) BacktestRequest req)
      throws DataUnavailableException {
    int n = req == null ? BacktestRequest.DEFAULT_NUM_CANDLES : req.numCandlesOrDefault();
    log.info("[BOT_HTTP] action=BACKTEST num_candles={}", n);
    return BacktestResponse.from(bot.backtest(n));
  }
}
