package org.agentmarket.simulator.core.trader;

import lombok.Getter;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.sizing.BetSizer;

/**
 * Evolvable population member. Owns its wallet and a shared, immutable bet sizer.
 */
@Getter
public abstract class Trader implements MarketParticipant, OrderPolicy {
    private final int id;
    private final BetSizer sizer;
    private double cash;
    private double position;

    protected Trader(int id, double cash, double position, BetSizer sizer) {
        this.id = id;
        this.cash = cash;
        this.position = position;
        this.sizer = sizer;
    }

    /**
     * Creates a fresh occupant for the given population slot with this trader's strategy
     * parameters and sizer, starting from the given wallet.
     */
    public abstract Trader spawn(int slotId, double initialCash, double initialPosition);

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

    protected Order order(OrderSide side, double price, double quantity, int tick) {
        return Order.builder()
                .side(side)
                .price(price)
                .traderId(id)
                .submittedAtTick(tick)
                .strategy(getStrategy())
                .quantity(quantity)
                .build();
    }

    protected Order hold(double marketPrice, int tick) {
        return Order.hold(id, getStrategy(), marketPrice, tick);
    }

    @Override
    public String toString() {
        return getStrategy().getLabel() + "#" + id;
    }
}
