package org.agentmarket.simulator.core.trader;

import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.sizing.BetSizer;

/**
 * Bets on reversion: buys when the short average has fallen below the long one, sells when above.
 */
public class MeanReverterTrader extends MovingAverageTrader {

    public MeanReverterTrader(int id, double cash, double position, BetSizer sizer,
                              int shortWindow, int longWindow, double priceStep) {
        super(id, cash, position, sizer, shortWindow, longWindow, priceStep);
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.MEAN_REVERTER;
    }

    @Override
    protected OrderSide signal(double shortMa, double longMa) {
        if (shortMa < longMa) {
            return OrderSide.BUY;
        }
        if (shortMa > longMa) {
            return OrderSide.SELL;
        }
        return OrderSide.HOLD;
    }

    @Override
    protected double expectedPrice(double marketPrice, double slope) {
        return marketPrice - marketPrice * slope * LOOKAHEAD_TICKS;
    }

    @Override
    public Trader spawn(int slotId, double initialCash, double initialPosition) {
        return new MeanReverterTrader(slotId, initialCash, initialPosition, getSizer(),
                getShortWindow(), getLongWindow(), getPriceStep());
    }
}
