package org.agentmarket.simulator.core.trader;

import org.agentmarket.simulator.core.model.MarketTick;
import org.agentmarket.simulator.core.model.Order;

import java.util.List;

/**
 * Produces one order per tick from the observable market state. Implemented by every trader
 * in the population; learning agents trained outside the simulator plug in through the same
 * contract.
 */
@FunctionalInterface
public interface OrderPolicy {

    /**
     * @param marketPrice  last trade price
     * @param bestBid      best resting bid, or null when there are no bids
     * @param bestAsk      best resting ask, or null when there are no asks
     * @param tickHistory  retained tick history, oldest first
     * @param currentTick  tick the order is submitted at
     * @return the order to submit; a HOLD order when the policy does not want to trade
     */
    Order decide(double marketPrice, Double bestBid, Double bestAsk, List<MarketTick> tickHistory, int currentTick);
}
