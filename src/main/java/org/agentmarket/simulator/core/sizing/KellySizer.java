package org.agentmarket.simulator.core.sizing;

import lombok.Value;

/**
 * Simplified, bounded Kelly criterion. The relative edge plays the role of the odds and
 * the resulting fraction is scaled down by {@code kellyFraction}.
 */
@Value
public class KellySizer implements BetSizer {
    double kellyFraction;
    double minBet;

    @Override
    public double size(double marketPrice, double expectedPrice, double confidence, double capital) {
        if (marketPrice <= 0) {
            return 0.0;
        }
        double edge = expectedPrice - marketPrice;
        double odds = Math.abs(edge / marketPrice);

        if (odds == 0.0 || confidence <= 0.5) {
            return 0.0;
        }

        double kelly = Math.min(1.0, Math.max(0.0, (confidence - (1.0 - confidence)) * odds));
        double bet = kellyFraction * kelly * capital;

        if (bet < minBet) {
            return 0.0;
        }
        return bet / marketPrice;
    }

    @Override
    public SizingMethod getMethod() {
        return SizingMethod.KELLY;
    }
}
