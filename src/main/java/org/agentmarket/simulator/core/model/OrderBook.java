package org.agentmarket.simulator.core.model;

import lombok.Getter;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

@Getter
public class OrderBook {
    // Bids: high to low, asks: low to high. firstKey() is the best price on both sides.
    private final NavigableMap<Double, PriceLevel> bids = new TreeMap<>(Collections.reverseOrder());
    private final NavigableMap<Double, PriceLevel> asks = new TreeMap<>();

    public NavigableMap<Double, PriceLevel> side(OrderSide side) {
        return switch (side) {
            case BUY -> bids;
            case SELL -> asks;
            case HOLD -> throw new IllegalArgumentException("HOLD orders have no book side");
        };
    }
}
