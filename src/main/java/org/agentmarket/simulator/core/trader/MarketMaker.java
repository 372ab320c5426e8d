package org.agentmarket.simulator.core.trader;

import lombok.Getter;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;

import java.util.List;

/**
 * Quotes both sides around the live market price every tick. Quotes are purged before the
 * next tick's quotes go in, so nothing the maker posts survives a tick.
 * <p>
 * The anchor price is kept for reporting only; quoting always centers on the price passed in.
 */
@Getter
public class MarketMaker implements MarketParticipant {
    private final int id;
    private final double anchorPrice;
    private final double halfSpread;
    private final double quoteSize;
    private double cash;
    private double position;

    public MarketMaker(int id, double anchorPrice, double halfSpread, double quoteSize) {
        this.id = id;
        this.anchorPrice = anchorPrice;
        this.halfSpread = halfSpread;
        this.quoteSize = quoteSize;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.MARKET_MAKER;
    }

    public List<Order> quote(double marketPrice, int currentTick) {
        return List.of(
                quoteOrder(OrderSide.BUY, marketPrice - halfSpread, currentTick),
                quoteOrder(OrderSide.SELL, marketPrice + halfSpread, currentTick));
    }

    private Order quoteOrder(OrderSide side, double price, int tick) {
        return Order.builder()
                .side(side)
                .price(price)
                .traderId(id)
                .submittedAtTick(tick)
                .strategy(StrategyType.MARKET_MAKER)
                .quantity(quoteSize)
                .build();
    }

    @Override
    public void applyFill(OrderSide side, double price, double quantity) {
        switch (side) {
            case BUY -> {
                cash -= price * quantity;
                position += quantity;
            }
            case SELL -> {
                cash += price * quantity;
                position -= quantity;
            }
            case HOLD -> throw new IllegalArgumentException("Cannot fill a HOLD order");
        }
    }

    @Override
    public String toString() {
        return "MarketMaker#" + id;
    }
}
