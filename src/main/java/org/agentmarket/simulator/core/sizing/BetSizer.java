package org.agentmarket.simulator.core.sizing;

/**
 * Converts an edge signal and available capital into an order quantity.
 * Implementations are stateless and safe to share between traders.
 */
public interface BetSizer {

    /**
     * @param marketPrice   price the order would execute around
     * @param expectedPrice price the trader expects the asset to move to
     * @param confidence    probability in [0, 1] that the expectation is right
     * @param capital       capital available to the trader, normally its mark-to-market value
     * @return quantity to trade, never negative
     */
    double size(double marketPrice, double expectedPrice, double confidence, double capital);

    SizingMethod getMethod();
}
