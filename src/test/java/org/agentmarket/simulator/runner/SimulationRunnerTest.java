package org.agentmarket.simulator.runner;

import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.market.MarketSimulator;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.model.WalletSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SimulationRunnerTest {

    @Mock
    private MarketSimulator marketSimulator;

    private SimulatorProperties properties;
    private SimulationRunner runner;

    @BeforeEach
    void setUp() {
        properties = new SimulatorProperties();
        runner = new SimulationRunner(properties, marketSimulator);
    }

    @Test
    void testRunsConfiguredTickCount() {
        properties.getRun().setTotalTicks(25);
        when(marketSimulator.getStandings()).thenReturn(List.of(
                WalletSnapshot.builder().traderId(3).strategy(StrategyType.MOMENTUM)
                        .sizingMethod("Kelly").cash(1000).position(2).markToMarketValue(1200).build()));
        when(marketSimulator.getAverageValueByStrategy()).thenReturn(Map.of(StrategyType.MOMENTUM, 1200.0));

        runner.run(new DefaultApplicationArguments());

        verify(marketSimulator, times(25)).tick();
        verify(marketSimulator).getStandings();
    }

    @Test
    void testZeroTicksDoesNothing() {
        properties.getRun().setTotalTicks(0);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(marketSimulator);
    }

    @Test
    void testStandingsLimitCapsOutput() {
        properties.getRun().setStandingsLimit(50);
        when(marketSimulator.getStandings()).thenReturn(List.of());
        when(marketSimulator.getAverageValueByStrategy()).thenReturn(Map.of());

        runner.runTicks(3);

        verify(marketSimulator, times(3)).tick();
        verify(marketSimulator).getAverageValueByStrategy();
    }
}
