package org.agentmarket.simulator.core.trader;

import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;

/**
 * Anything that owns a wallet and can be a counterparty of a fill.
 */
public interface MarketParticipant {

    int getId();

    StrategyType getStrategy();

    double getCash();

    double getPosition();

    /**
     * Applies one side of a fill: a buyer pays {@code price * quantity} and receives the quantity,
     * a seller the reverse.
     */
    void applyFill(OrderSide side, double price, double quantity);

    default double getValue(double marketPrice) {
        return getPosition() * marketPrice + getCash();
    }
}
