package org.agentmarket.simulator.core.trader;

import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.StrategyType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketMakerTest {

    @Test
    void testQuotesBothSidesAroundLivePrice() {
        MarketMaker maker = new MarketMaker(100000, 100.0, 0.25, 10.0);

        List<Order> quotes = maker.quote(120.0, 6);

        assertEquals(2, quotes.size());
        Order bid = quotes.get(0);
        Order ask = quotes.get(1);
        assertEquals(OrderSide.BUY, bid.getSide());
        assertEquals(119.75, bid.getPrice(), 1e-9);
        assertEquals(OrderSide.SELL, ask.getSide());
        assertEquals(120.25, ask.getPrice(), 1e-9);
        for (Order quote : quotes) {
            assertEquals(10.0, quote.getQuantity(), 1e-9);
            assertEquals(StrategyType.MARKET_MAKER, quote.getStrategy());
            assertEquals(100000, quote.getTraderId());
            assertEquals(6, quote.getSubmittedAtTick());
        }
    }

    @Test
    void testAnchorPriceDoesNotMoveQuotes() {
        MarketMaker low = new MarketMaker(100000, 50.0, 0.25, 10.0);
        MarketMaker high = new MarketMaker(100001, 500.0, 0.25, 10.0);

        assertEquals(low.quote(100.0, 0).get(0).getPrice(), high.quote(100.0, 0).get(0).getPrice(), 1e-12);
    }

    @Test
    void testFillsTrackInventory() {
        MarketMaker maker = new MarketMaker(100000, 100.0, 0.25, 10.0);

        maker.applyFill(OrderSide.BUY, 99.75, 10);
        maker.applyFill(OrderSide.SELL, 100.25, 4);

        assertEquals(6, maker.getPosition(), 1e-9);
        assertEquals(-997.5 + 401, maker.getCash(), 1e-9);
        assertEquals(-997.5 + 401 + 600, maker.getValue(100.0), 1e-9);
    }
}
