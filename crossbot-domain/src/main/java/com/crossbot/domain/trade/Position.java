package com.crossbot.domain.trade;

/**
 * The single open long position. Absence of a position is modelled as null by its owners.
 */
public record Position(double entryPrice, double quantity, double entryTimestamp) {

    public Position {
        if (!(entryPrice > 0)) throw new IllegalArgumentException("entryPrice must be positive: " + entryPrice);
        if (!(quantity > 0)) throw new IllegalArgumentException("quantity must be positive: " + quantity);
    }

    /** Position created by the given BUY trade. */
    public static Position openedBy(Trade buy) {
        if (buy.action() != TradeSide.BUY) {
            throw new IllegalArgumentException("Position can only be opened by a BUY: " + buy);
        }
        return new Position(buy.price(), buy.quantity(), buy.timestamp());
    }

    /** P&L realized if closed at exitPrice. */
    public double pnlAt(double exitPrice) {
        return (exitPrice - entryPrice) * quantity;
    }
}
