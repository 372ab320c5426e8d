package org.agentmarket.simulator.core.trader;

import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.sizing.BetSizer;

/**
 * Follows the trend: buys when the short average is above the long one, sells when below.
 */
public class MomentumTrader extends MovingAverageTrader {

    public MomentumTrader(int id, double cash, double position, BetSizer sizer,
                          int shortWindow, int longWindow, double priceStep) {
        super(id, cash, position, sizer, shortWindow, longWindow, priceStep);
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.MOMENTUM;
    }

    @Override
    protected OrderSide signal(double shortMa, double longMa) {
        if (shortMa > longMa) {
            return OrderSide.BUY;
        }
        if (shortMa < longMa) {
            return OrderSide.SELL;
        }
        return OrderSide.HOLD;
    }

    @Override
    protected double expectedPrice(double marketPrice, double slope) {
        return marketPrice + marketPrice * slope * LOOKAHEAD_TICKS;
    }

    @Override
    public Trader spawn(int slotId, double initialCash, double initialPosition) {
        return new MomentumTrader(slotId, initialCash, initialPosition, getSizer(),
                getShortWindow(), getLongWindow(), getPriceStep());
    }
}
