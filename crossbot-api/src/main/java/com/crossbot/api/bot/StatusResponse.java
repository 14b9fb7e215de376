package com.crossbot.api.bot;

import com.crossbot.application.service.BotStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StatusResponse(
    boolean running,
    String state,
    @JsonProperty("open_position_price") Double openPositionPrice,
    @JsonProperty("trade_count") int tradeCount,
    @JsonProperty("realized_profit") double realizedProfit,
    @JsonProperty("last_tick_at") String lastTickAt,
    @JsonProperty("last_error") String lastError
) {

  static StatusResponse from(BotStatus s) {
    return new StatusResponse(
        s.running(),
        s.state().name(),
        s.openPositionPrice(),
        s.tradeCount(),
        s.realizedProfit(),
        s.lastTickAt() == null ? null : s.lastTickAt().toString(),
        s.lastError()
    );
  }
}
