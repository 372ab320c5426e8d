package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything an exporter needs about one completed tick.
 */
@Value
@Builder
public class TickResult {
    MarketTick tick;
    List<Trade> trades;
    PopulationCounts counts;
    Map<StrategyType, Double> volumeByStrategy;
    boolean evolved;
}
