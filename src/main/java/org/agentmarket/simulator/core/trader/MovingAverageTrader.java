package org.agentmarket.simulator.core.trader;

import lombok.Getter;
import org.agentmarket.simulator.core.model.MarketTick;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.sizing.BetSizer;

import java.util.List;

/**
 * Base for strategies driven by a short/long moving-average crossover over the per-tick VWAP.
 * Subclasses decide which way a crossover points and where the expected price lies.
 */
@Getter
public abstract class MovingAverageTrader extends Trader {
    /**
     * Ticks the normalized slope is extrapolated over when forming the expected price.
     */
    static final int LOOKAHEAD_TICKS = 1000;
    static final double MAX_SLOPE = 0.01;
    static final double FULL_CONFIDENCE = 1.0;

    private final int shortWindow;
    private final int longWindow;
    private final double priceStep;

    protected MovingAverageTrader(int id, double cash, double position, BetSizer sizer,
                                  int shortWindow, int longWindow, double priceStep) {
        super(id, cash, position, sizer);
        if (shortWindow <= 0 || longWindow <= 0) {
            throw new IllegalArgumentException("Moving average windows must be positive: short="
                    + shortWindow + ", long=" + longWindow);
        }
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;
        this.priceStep = priceStep;
    }

    /**
     * Side to trade for the given averages, HOLD when there is no signal.
     */
    protected abstract OrderSide signal(double shortMa, double longMa);

    /**
     * Expected price given the clamped, normalized moving-average slope.
     */
    protected abstract double expectedPrice(double marketPrice, double slope);

    @Override
    public Order decide(double marketPrice, Double bestBid, Double bestAsk, List<MarketTick> tickHistory, int currentTick) {
        if (tickHistory.size() < Math.max(shortWindow, longWindow)) {
            return hold(marketPrice, currentTick);
        }

        double shortMa = movingAverage(tickHistory, shortWindow);
        double longMa = movingAverage(tickHistory, longWindow);
        OrderSide side = signal(shortMa, longMa);
        if (side == OrderSide.HOLD) {
            return hold(marketPrice, currentTick);
        }

        double slope = slope(shortMa, longMa);
        double quantity = getSizer().size(marketPrice, expectedPrice(marketPrice, slope),
                FULL_CONFIDENCE, getValue(marketPrice));
        if (quantity <= Order.QUANTITY_EPSILON) {
            return hold(marketPrice, currentTick);
        }

        if (side == OrderSide.BUY) {
            if (bestAsk != null && getCash() >= bestAsk * quantity) {
                return order(OrderSide.BUY, bestAsk + priceStep, quantity, currentTick);
            }
        } else if (bestBid != null && getPosition() >= quantity && bestBid - priceStep > 0) {
            return order(OrderSide.SELL, bestBid - priceStep, quantity, currentTick);
        }
        return hold(marketPrice, currentTick);
    }

    double slope(double shortMa, double longMa) {
        double raw = (shortMa - longMa) / Math.max(1, longWindow - shortWindow);
        return Math.max(-MAX_SLOPE, Math.min(MAX_SLOPE, raw));
    }

    static double movingAverage(List<MarketTick> tickHistory, int window) {
        int size = tickHistory.size();
        int start = Math.max(0, size - window);
        double sum = 0.0;
        for (MarketTick tick : tickHistory.subList(start, size)) {
            sum += tick.getVwap();
        }
        return sum / (size - start);
    }
}
