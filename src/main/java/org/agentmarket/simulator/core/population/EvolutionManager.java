package org.agentmarket.simulator.core.population;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.event.PopulationEvolvedEvent;
import org.agentmarket.simulator.core.model.EvolutionOutcome;
import org.agentmarket.simulator.core.model.PopulationCounts;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.trader.Trader;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Periodic selection step: ranks traders by mark-to-market value and refills the weakest
 * slots with clones of the best trader, always sparing the best trader of each strategy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvolutionManager {
    private final SimulatorProperties properties;
    private final PopulationManager populationManager;
    private final ApplicationEventPublisher eventPublisher;

    public boolean isDue(int tick) {
        SimulatorProperties.Evolution evolution = properties.getEvolution();
        return evolution.isEnabled() && tick % evolution.getIntervalTicks() == 0;
    }

    public Optional<EvolutionOutcome> evolveIfDue(int tick, double marketPrice) {
        if (!isDue(tick)) {
            return Optional.empty();
        }
        return evolve(tick, marketPrice);
    }

    public Optional<EvolutionOutcome> evolve(int tick, double marketPrice) {
        Population population = populationManager.getPopulation();
        if (population.size() == 0) {
            return Optional.empty();
        }

        List<Trader> ranked = new ArrayList<>(population.getTraders());
        ranked.sort(Comparator.comparingDouble((Trader t) -> t.getValue(marketPrice)).reversed());

        Set<Integer> exempt = bestPerStrategy(ranked);
        int killCount = (int) Math.round(ranked.size() * properties.getEvolution().getKillPercentage());

        List<Integer> marked = new ArrayList<>();
        for (int i = ranked.size() - 1; i >= 0 && marked.size() < killCount; i--) {
            int id = ranked.get(i).getId();
            if (!exempt.contains(id)) {
                marked.add(id);
            }
        }

        Trader winner = ranked.get(0);
        SimulatorProperties.Wallet wallet = properties.getWallet();
        for (int id : marked) {
            population.replace(winner.spawn(id, wallet.getInitialCash(), wallet.getInitialPosition()));
        }

        PopulationCounts counts = population.counts(tick);
        EvolutionOutcome outcome = EvolutionOutcome.builder()
                .tick(tick)
                .winnerId(winner.getId())
                .winnerStrategy(winner.getStrategy())
                .exemptIds(exempt)
                .replacedIds(marked)
                .counts(counts)
                .build();

        log.info("Evolution at tick {}: winner={} value={}, replaced {} traders, counts noise={} meanReverters={} momentum={}",
                tick, winner, winner.getValue(marketPrice), marked.size(),
                counts.getNoise(), counts.getMeanReverters(), counts.getMomentum());
        eventPublisher.publishEvent(new PopulationEvolvedEvent(this, outcome));
        return Optional.of(outcome);
    }

    /**
     * First occurrence of each evolvable strategy walking the ranking from the top.
     */
    private static Set<Integer> bestPerStrategy(List<Trader> ranked) {
        Map<StrategyType, Integer> best = new EnumMap<>(StrategyType.class);
        for (Trader trader : ranked) {
            if (trader.getStrategy().isEvolvable()) {
                best.putIfAbsent(trader.getStrategy(), trader.getId());
            }
            if (best.size() == StrategyType.EVOLVABLE.size()) {
                break;
            }
        }
        return new LinkedHashSet<>(best.values());
    }
}
