package com.crossbot.domain.risk;

import com.crossbot.domain.ConfigurationException;
import com.crossbot.domain.order.TradeAction;
import com.crossbot.domain.trade.Position;
import com.crossbot.domain.trade.Trade;

/**
 * Long-only, single-position risk rules.
 *
 * Per tick, in this order:
 *  1) BUY signal while flat opens {@code baseAssetAmount} at the current price.
 *  2) SELL signal while long closes at the current price.
 *  3) If still long: stop-loss, then take-profit, close at the current price.
 *
 * A BUY while long is ignored.
 */
public class RiskManager {

    private final double baseAssetAmount;
    private final double stopLossPct;       // e.g. 0.02 = 2%
    private final double takeProfitPct;     // e.g. 0.03 = 3%

    public RiskManager(double baseAssetAmount, double stopLossPct, double takeProfitPct) {
        if (!(baseAssetAmount > 0)) {
            throw new ConfigurationException("base_asset_amount must be positive: " + baseAssetAmount);
        }
        if (!(stopLossPct > 0 && stopLossPct < 1)) {
            throw new ConfigurationException("stop_loss_pct must be in (0, 1): " + stopLossPct);
        }
        if (!(takeProfitPct > 0)) {
            throw new ConfigurationException("take_profit_pct must be positive: " + takeProfitPct);
        }
        this.baseAssetAmount = baseAssetAmount;
        this.stopLossPct = stopLossPct;
        this.takeProfitPct = takeProfitPct;
    }

    /** Stop price for a long position. */
    public double calcStopPrice(double entryPrice) {
        if (entryPrice <= 0) return 0.0;
        return entryPrice * (1.0 - stopLossPct);
    }

    /** Take profit price for a long position. */
    public double calcTakeProfitPrice(double entryPrice) {
        if (entryPrice <= 0) return 0.0;
        return entryPrice * (1.0 + takeProfitPct);
    }

    /** SL hit check for long position. */
    public boolean hitSL(double currentPrice, double entryPrice) {
        if (entryPrice <= 0) return false;
        return currentPrice <= calcStopPrice(entryPrice);
    }

    /** TP hit check for long position. */
    public boolean hitTP(double currentPrice, double entryPrice) {
        if (entryPrice <= 0) return false;
        return currentPrice >= calcTakeProfitPrice(entryPrice);
    }

    /**
     * Applies signal and threshold rules to the current position.
     *
     * @param position  open position or null
     * @param signal    strategy output for this tick
     * @param price     latest price
     * @param timestamp timestamp stamped on any resulting trade
     */
    public RiskDecision evaluate(Position position, TradeAction signal, double price, double timestamp) {
        if (position == null) {
            if (signal == TradeAction.BUY) {
                return RiskDecision.open(Trade.buy(timestamp, price, baseAssetAmount));
            }
            return RiskDecision.none(null);
        }

        if (signal == TradeAction.SELL) {
            return close(position, price, timestamp, ExitReason.SIGNAL);
        }
        if (hitSL(price, position.entryPrice())) {
            return close(position, price, timestamp, ExitReason.STOP_LOSS);
        }
        if (hitTP(price, position.entryPrice())) {
            return close(position, price, timestamp, ExitReason.TAKE_PROFIT);
        }
        return RiskDecision.none(position);
    }

    private static RiskDecision close(Position position, double price, double timestamp, ExitReason reason) {
        Trade sell = Trade.sell(timestamp, price, position.quantity());
        return RiskDecision.close(sell, reason, position.pnlAt(price));
    }
}
