package org.agentmarket.simulator;

import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.event.PopulationEvolvedEvent;
import org.agentmarket.simulator.core.event.TickCompletedEvent;
import org.agentmarket.simulator.core.event.TradeExecutedEvent;
import org.agentmarket.simulator.core.market.MarketSimulator;
import org.agentmarket.simulator.core.model.PopulationCounts;
import org.agentmarket.simulator.core.orderbook.OrderBookManager;
import org.agentmarket.simulator.core.population.PopulationManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@RecordApplicationEvents
public class MarketSimulatorIntegrationTest {

    @Autowired
    private SimulatorProperties properties;

    @Autowired
    private MarketSimulator marketSimulator;

    @Autowired
    private OrderBookManager orderBookManager;

    @Autowired
    private PopulationManager populationManager;

    @Autowired
    private ApplicationEvents events;

    @Test
    void testFullRun() {
        // 0. Context comes up with the configured population and no ticks run yet
        assertEquals(7L, properties.getSeed());
        assertEquals(0, marketSimulator.getCurrentTick());
        PopulationCounts initial = marketSimulator.getPopulationCounts();
        assertEquals(12, initial.getNoise());
        assertEquals(6, initial.getMeanReverters());
        assertEquals(6, initial.getMomentum());
        assertEquals(1, initial.getMarketMakers());

        // 1. Run through several evolution rounds
        for (int i = 0; i < 200; i++) {
            marketSimulator.tick();
            assertFalse(orderBookManager.isCrossed());
        }

        // 2. Market state
        assertEquals(200, marketSimulator.getCurrentTick());
        assertEquals(200, marketSimulator.getTickHistory().size());
        assertTrue(marketSimulator.getMarketPrice() > 0);

        // 3. Events reached the context
        assertEquals(200, events.stream(TickCompletedEvent.class).count());
        assertEquals(4, events.stream(PopulationEvolvedEvent.class).count());
        assertTrue(events.stream(TradeExecutedEvent.class).count() > 0);
        assertTrue(events.stream(TradeExecutedEvent.class)
                .noneMatch(e -> e.getTrade().getBuyerId() == e.getTrade().getSellerId()));

        // 4. Population survived selection intact
        PopulationCounts counts = marketSimulator.getPopulationCounts();
        assertEquals(24, counts.getTraders());
        assertEquals(24, populationManager.getPopulation().size());
        assertTrue(counts.getNoise() >= 1);
        assertTrue(counts.getMeanReverters() >= 1);
        assertTrue(counts.getMomentum() >= 1);
        assertEquals(5, marketSimulator.getCountsHistory().size());
    }
}
