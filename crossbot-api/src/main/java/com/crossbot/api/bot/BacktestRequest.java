package com.crossbot.api.bot;

import com.crossbot.application.service.BotController;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Body of POST /backtest. A missing num_candles means 500; at most 1000.
 */
public record BacktestRequest(
    @JsonProperty("num_candles") @Min(value = 1, message = "must be >= 1")
    @Max(value = BotController.MAX_BACKTEST_CANDLES, message = "must be <= 1000") Integer numCandles
) {

  public static final int DEFAULT_NUM_CANDLES = 500;

  public int numCandlesOrDefault() {
    return numCandles == null ? DEFAULT_NUM_CANDLES : numCandles;
  }
}
