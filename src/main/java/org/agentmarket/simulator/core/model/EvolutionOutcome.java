package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class EvolutionOutcome {
    int tick;
    int winnerId;
    StrategyType winnerStrategy;
    Set<Integer> exemptIds;
    List<Integer> replacedIds;
    PopulationCounts counts;
}
