package org.agentmarket.simulator.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarketTick {
    double lastTradePrice;
    double volume;
    double vwap;
    double midPrice;
    int tick;
}
