package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PopulationCounts {
    int tick;
    int noise;
    int meanReverters;
    int momentum;
    int marketMakers;

    public int count(StrategyType strategy) {
        return switch (strategy) {
            case NOISE -> noise;
            case MEAN_REVERTER -> meanReverters;
            case MOMENTUM -> momentum;
            case MARKET_MAKER -> marketMakers;
        };
    }

    public int getTraders() {
        return noise + meanReverters + momentum;
    }
}
