package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Data;

/**
 * Limit order as produced by a participant. Identity fields never change; quantity is the
 * remaining quantity and shrinks as the order is filled.
 */
@Data
@Builder(toBuilder = true)
public class Order {
    /**
     * Remaining quantities at or below this are treated as exhausted.
     */
    public static final double QUANTITY_EPSILON = 1e-9;

    private final OrderSide side;
    private final double price;
    private final int traderId;
    private final int submittedAtTick;
    private final StrategyType strategy;
    private double quantity;

    public static Order hold(int traderId, StrategyType strategy, double marketPrice, int tick) {
        return Order.builder()
                .side(OrderSide.HOLD)
                .price(marketPrice)
                .traderId(traderId)
                .submittedAtTick(tick)
                .strategy(strategy)
                .quantity(0)
                .build();
    }

    public boolean isHold() {
        return side == OrderSide.HOLD;
    }

    public boolean isExhausted() {
        return quantity <= QUANTITY_EPSILON;
    }

    public void fill(double amount) {
        if (amount <= 0) {
            return;
        }
        quantity -= amount;
        if (isExhausted()) {
            quantity = 0;
        }
    }

    /**
     * Copy owned by the book, so later fills never touch the submitter's instance.
     */
    public Order copy() {
        return toBuilder().build();
    }
}
