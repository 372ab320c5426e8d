package org.agentmarket.simulator.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.market.MarketSimulator;
import org.agentmarket.simulator.core.model.WalletSnapshot;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Batch driving loop: runs {@code simulator.run.total-ticks} ticks at startup and logs the
 * final standings. Does nothing when the tick count is zero.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationRunner implements ApplicationRunner {
    private final SimulatorProperties properties;
    private final MarketSimulator marketSimulator;

    @Override
    public void run(ApplicationArguments args) {
        int totalTicks = properties.getRun().getTotalTicks();
        if (totalTicks <= 0) {
            log.debug("Batch run disabled (simulator.run.total-ticks={})", totalTicks);
            return;
        }
        runTicks(totalTicks);
    }

    public void runTicks(int totalTicks) {
        log.info("Starting batch run of {} ticks", totalTicks);
        long start = System.nanoTime();
        for (int i = 0; i < totalTicks; i++) {
            marketSimulator.tick();
        }
        double elapsedSeconds = (System.nanoTime() - start) / 1_000_000_000.0;
        log.info("Simulation completed in {} seconds: tick={}, price={}",
                String.format("%.3f", elapsedSeconds), marketSimulator.getCurrentTick(), marketSimulator.getMarketPrice());
        logStandings();
    }

    private void logStandings() {
        List<WalletSnapshot> standings = marketSimulator.getStandings();
        int limit = Math.min(properties.getRun().getStandingsLimit(), standings.size());
        log.info("Top {} of {} traders:", limit, standings.size());
        for (WalletSnapshot wallet : standings.subList(0, limit)) {
            log.info("  {} {} :: {} - {}", wallet.getStrategy().getLabel(), wallet.getTraderId(),
                    String.format("%.2f", wallet.getMarkToMarketValue()), wallet.getSizingMethod());
        }
        marketSimulator.getAverageValueByStrategy().forEach((strategy, value) ->
                log.info("  average value {}: {}", strategy.getLabel(), String.format("%.2f", value)));
    }
}
