package com.crossbot.application.service;

import com.crossbot.application.lifecycle.BotState;

import java.time.Instant;

/**
 * Read-only status view.
 *
 * @param openPositionPrice entry price of the open position, or null when flat
 * @param lastTickAt        time of the last live tick (success or failure), or null
 * @param lastError         message of the last failed tick, cleared by the next success
 */
public record BotStatus(boolean running,
                        BotState state,
                        Double openPositionPrice,
                        int tradeCount,
                        double realizedProfit,
                        Instant lastTickAt,
                        String lastError) {
}
