package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Trade {
    double price;
    double quantity;
    int buyerId;
    int sellerId;
    int tick;
    StrategyType buyerStrategy;
    StrategyType sellerStrategy;
    /**
     * Side of the incoming order that crossed the resting one.
     */
    OrderSide aggressorSide;

    public double getNotional() {
        return price * quantity;
    }

    public StrategyType getTakerStrategy() {
        return aggressorSide == OrderSide.BUY ? buyerStrategy : sellerStrategy;
    }
}
