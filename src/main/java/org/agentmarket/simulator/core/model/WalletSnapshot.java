package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WalletSnapshot {
    int traderId;
    StrategyType strategy;
    String sizingMethod;
    double cash;
    double position;
    double markToMarketValue;
}
