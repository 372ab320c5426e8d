package org.agentmarket.simulator.core.trader;

import lombok.Getter;
import org.agentmarket.simulator.core.model.MarketTick;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.sizing.BetSizer;

import java.util.List;
import java.util.Random;

/**
 * Trades one unit on a random side at a price scattered around the market price.
 */
@Getter
public class NoiseTrader extends Trader {
    static final double ORDER_SIZE = 1.0;

    private final double noiseWeight;
    private final double holdProbability;
    private final Random random;

    public NoiseTrader(int id, double cash, double position, BetSizer sizer,
                       double noiseWeight, double holdProbability, Random random) {
        super(id, cash, position, sizer);
        this.noiseWeight = noiseWeight;
        this.holdProbability = holdProbability;
        this.random = random;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.NOISE;
    }

    @Override
    public Order decide(double marketPrice, Double bestBid, Double bestAsk, List<MarketTick> tickHistory, int currentTick) {
        OrderSide side = drawSide();
        double price = marketPrice + noiseWeight * marketPrice * random.nextGaussian();

        if (side == OrderSide.HOLD || price <= 0) {
            return hold(marketPrice, currentTick);
        }
        if (side == OrderSide.BUY && getCash() < price * ORDER_SIZE) {
            return hold(marketPrice, currentTick);
        }
        if (side == OrderSide.SELL && getPosition() < ORDER_SIZE) {
            return hold(marketPrice, currentTick);
        }
        return order(side, price, ORDER_SIZE, currentTick);
    }

    private OrderSide drawSide() {
        double draw = random.nextDouble();
        double tradeShare = (1.0 - holdProbability) / 2.0;
        if (draw < tradeShare) {
            return OrderSide.BUY;
        }
        if (draw < 2 * tradeShare) {
            return OrderSide.SELL;
        }
        return OrderSide.HOLD;
    }

    @Override
    public Trader spawn(int slotId, double initialCash, double initialPosition) {
        return new NoiseTrader(slotId, initialCash, initialPosition, getSizer(), noiseWeight, holdProbability, random);
    }
}
