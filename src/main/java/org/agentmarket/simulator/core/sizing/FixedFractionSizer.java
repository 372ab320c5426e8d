package org.agentmarket.simulator.core.sizing;

import lombok.Value;

/**
 * Commits a fixed fraction of capital regardless of the edge.
 */
@Value
public class FixedFractionSizer implements BetSizer {
    double fraction;

    @Override
    public double size(double marketPrice, double expectedPrice, double confidence, double capital) {
        if (marketPrice <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (fraction * capital) / marketPrice);
    }

    @Override
    public SizingMethod getMethod() {
        return SizingMethod.FIXED_FRACTION;
    }
}
