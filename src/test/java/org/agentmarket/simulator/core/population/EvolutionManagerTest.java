package org.agentmarket.simulator.core.population;

import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.event.PopulationEvolvedEvent;
import org.agentmarket.simulator.core.model.EvolutionOutcome;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.sizing.BetSizer;
import org.agentmarket.simulator.core.sizing.FixedFractionSizer;
import org.agentmarket.simulator.core.trader.MeanReverterTrader;
import org.agentmarket.simulator.core.trader.MomentumTrader;
import org.agentmarket.simulator.core.trader.NoiseTrader;
import org.agentmarket.simulator.core.trader.Trader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvolutionManagerTest {

    private static final double PRICE = 100.0;

    @Mock
    private PopulationManager populationManager;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SimulatorProperties properties;
    private EvolutionManager evolutionManager;
    private BetSizer noiseSizer;
    private Population population;

    @BeforeEach
    void setUp() {
        properties = new SimulatorProperties();
        properties.getEvolution().setEnabled(true);
        properties.getEvolution().setIntervalTicks(50);
        properties.getEvolution().setKillPercentage(0.34);
        properties.getWallet().setInitialCash(100000);
        properties.getWallet().setInitialPosition(10);
        evolutionManager = new EvolutionManager(properties, populationManager, eventPublisher);

        noiseSizer = new FixedFractionSizer(0.01);
        BetSizer maSizer = new FixedFractionSizer(0.02);
        Random random = new Random(3);
        double[] cash = {9000, 1000, 2000, 8000, 500, 3000, 7000, 100, 4000};
        List<Trader> traders = List.of(
                new NoiseTrader(0, cash[0], 0, noiseSizer, 0.01, 0, random),
                new NoiseTrader(1, cash[1], 0, noiseSizer, 0.01, 0, random),
                new NoiseTrader(2, cash[2], 0, noiseSizer, 0.01, 0, random),
                new MeanReverterTrader(3, cash[3], 0, maSizer, 2, 4, 0.01),
                new MeanReverterTrader(4, cash[4], 0, maSizer, 2, 4, 0.01),
                new MeanReverterTrader(5, cash[5], 0, maSizer, 2, 4, 0.01),
                new MomentumTrader(6, cash[6], 0, maSizer, 2, 4, 0.01),
                new MomentumTrader(7, cash[7], 0, maSizer, 2, 4, 0.01),
                new MomentumTrader(8, cash[8], 0, maSizer, 2, 4, 0.01));
        population = new Population(traders, List.of());
    }

    @Test
    void testReplacesWorstNonExemptWithWinnerClones() {
        when(populationManager.getPopulation()).thenReturn(population);

        EvolutionOutcome outcome = evolutionManager.evolve(50, PRICE).orElseThrow();

        assertEquals(0, outcome.getWinnerId());
        assertEquals(StrategyType.NOISE, outcome.getWinnerStrategy());
        assertEquals(Set.of(0, 3, 6), outcome.getExemptIds());
        assertEquals(List.of(7, 4, 1), outcome.getReplacedIds());

        for (int id : List.of(1, 4, 7)) {
            Trader clone = population.findTrader(id).orElseThrow();
            assertTrue(clone instanceof NoiseTrader, "slot " + id + " should hold a noise trader");
            assertSame(noiseSizer, clone.getSizer());
            assertEquals(100000, clone.getCash());
            assertEquals(10, clone.getPosition());
        }
        assertEquals(5, outcome.getCounts().getNoise());
        assertEquals(2, outcome.getCounts().getMeanReverters());
        assertEquals(2, outcome.getCounts().getMomentum());
        assertEquals(9, population.size());
    }

    @Test
    void testSlotOrderIsPreserved() {
        when(populationManager.getPopulation()).thenReturn(population);

        evolutionManager.evolve(50, PRICE);

        List<Integer> ids = population.getTraders().stream().map(Trader::getId).toList();
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8), ids);
    }

    @Test
    void testFullKillStillKeepsOneTraderPerStrategy() {
        properties.getEvolution().setKillPercentage(1.0);
        when(populationManager.getPopulation()).thenReturn(population);

        EvolutionOutcome outcome = evolutionManager.evolve(50, PRICE).orElseThrow();

        assertEquals(6, outcome.getReplacedIds().size());
        assertEquals(7, outcome.getCounts().getNoise());
        assertEquals(1, outcome.getCounts().getMeanReverters());
        assertEquals(1, outcome.getCounts().getMomentum());
    }

    @Test
    void testZeroKillOnlyReports() {
        properties.getEvolution().setKillPercentage(0.0);
        when(populationManager.getPopulation()).thenReturn(population);

        EvolutionOutcome outcome = evolutionManager.evolve(50, PRICE).orElseThrow();

        assertTrue(outcome.getReplacedIds().isEmpty());
        assertEquals(3, outcome.getCounts().getNoise());
    }

    @Test
    void testPublishesOutcome() {
        when(populationManager.getPopulation()).thenReturn(population);

        EvolutionOutcome outcome = evolutionManager.evolve(50, PRICE).orElseThrow();

        ArgumentCaptor<PopulationEvolvedEvent> captor = ArgumentCaptor.forClass(PopulationEvolvedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertSame(outcome, captor.getValue().getOutcome());
    }

    @Test
    void testDueOnlyOnInterval() {
        assertTrue(evolutionManager.isDue(50));
        assertTrue(evolutionManager.isDue(100));
        assertFalse(evolutionManager.isDue(49));

        properties.getEvolution().setEnabled(false);
        assertFalse(evolutionManager.isDue(50));
    }

    @Test
    void testEvolveIfDueSkipsOffInterval() {
        Optional<EvolutionOutcome> outcome = evolutionManager.evolveIfDue(51, PRICE);

        assertTrue(outcome.isEmpty());
        verifyNoInteractions(eventPublisher, populationManager);
    }

    @Test
    void testEmptyPopulationIsNoOp() {
        when(populationManager.getPopulation()).thenReturn(new Population(List.of(), List.of()));

        assertTrue(evolutionManager.evolve(50, PRICE).isEmpty());
    }
}
