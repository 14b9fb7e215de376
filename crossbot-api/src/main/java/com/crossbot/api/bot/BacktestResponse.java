package com.crossbot.api.bot;

import com.crossbot.application.engine.BacktestResult;
import com.crossbot.domain.trade.Trade;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BacktestResponse(
    double profit,
    @JsonProperty("trade_count") int tradeCount,
    List<TradeView> trades,
    @JsonProperty("closed_trades") int closedTrades,
    int wins,
    @JsonProperty("win_rate") double winRate,
    @JsonProperty("open_at_end") boolean openAtEnd
) {

  public record TradeView(double timestamp, String action, double price, double quantity) {
    static TradeView from(Trade t) {
      return new TradeView(t.timestamp(), t.action().name(), t.price(), t.quantity());
    }
  }

  static BacktestResponse from(BacktestResult r) {
    return new BacktestResponse(
        r.profit(),
        r.tradeCount(),
        r.trades().stream().map(TradeView::from).toList(),
        r.closedTrades(),
        r.wins(),
        r.winRate(),
        r.openAtEnd()
    );
  }
}
