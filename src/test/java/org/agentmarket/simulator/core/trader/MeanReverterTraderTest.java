package org.agentmarket.simulator.core.trader;

import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.sizing.FixedFractionSizer;
import org.agentmarket.simulator.core.sizing.KellySizer;
import org.junit.jupiter.api.Test;

import static org.agentmarket.simulator.core.trader.MovingAverageTraderFixtures.history;
import static org.junit.jupiter.api.Assertions.*;

class MeanReverterTraderTest {

    private static final double PRICE = 100.0;
    private static final double BID = 99.0;
    private static final double ASK = 101.0;

    @Test
    void testBuysAfterDrop() {
        MeanReverterTrader trader = new MeanReverterTrader(4, 100000, 10, new FixedFractionSizer(0.01), 2, 4, 0.01);

        Order order = trader.decide(PRICE, BID, ASK, history(103, 102, 101, 100), 4);

        assertEquals(OrderSide.BUY, order.getSide());
        assertEquals(101.01, order.getPrice(), 1e-9);
        assertEquals(10.1, order.getQuantity(), 1e-9);
        assertEquals(StrategyType.MEAN_REVERTER, order.getStrategy());
    }

    @Test
    void testSellsAfterRally() {
        MeanReverterTrader trader = new MeanReverterTrader(4, 100000, 20, new FixedFractionSizer(0.01), 2, 4, 0.01);

        Order order = trader.decide(PRICE, BID, ASK, history(100, 101, 102, 103), 4);

        assertEquals(OrderSide.SELL, order.getSide());
        assertEquals(98.99, order.getPrice(), 1e-9);
    }

    @Test
    void testKellySizingSeesReversionTarget() {
        // slope clamps to -0.01 in a drop, target 100 * (1 + 10) is the same distance as momentum's
        MeanReverterTrader trader = new MeanReverterTrader(4, 100000, 10, new KellySizer(0.5, 1.0), 2, 4, 0.01);

        Order order = trader.decide(PRICE, BID, ASK, history(103, 102, 101, 100), 4);

        assertEquals(OrderSide.BUY, order.getSide());
        assertEquals(0.5 * 101000 / 100, order.getQuantity(), 1e-9);
    }

    @Test
    void testHoldsWithShortHistory() {
        MeanReverterTrader trader = new MeanReverterTrader(4, 100000, 10, new FixedFractionSizer(0.01), 2, 4, 0.01);

        assertTrue(trader.decide(PRICE, BID, ASK, history(100, 99), 2).isHold());
    }

    @Test
    void testSpawnCreatesMeanReverter() {
        MeanReverterTrader parent = new MeanReverterTrader(4, 1, 1, new FixedFractionSizer(0.01), 3, 12, 0.01);

        Trader clone = parent.spawn(8, 100000, 10);

        assertEquals(StrategyType.MEAN_REVERTER, clone.getStrategy());
        assertEquals(3, ((MeanReverterTrader) clone).getShortWindow());
        assertEquals(12, ((MeanReverterTrader) clone).getLongWindow());
    }
}
