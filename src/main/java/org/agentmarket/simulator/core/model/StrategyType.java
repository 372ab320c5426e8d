package org.agentmarket.simulator.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum StrategyType {
    NOISE("Monkey"),
    MEAN_REVERTER("MeanReverter"),
    MOMENTUM("MomentumTrader"),
    MARKET_MAKER("MarketMaker");

    /**
     * Strategies that take part in evolution. Makers are created once and never replaced.
     */
    public static final Set<StrategyType> EVOLVABLE = EnumSet.of(NOISE, MEAN_REVERTER, MOMENTUM);

    private final String label;

    public boolean isEvolvable() {
        return EVOLVABLE.contains(this);
    }
}
