package org.agentmarket.simulator.core.model;

public enum OrderSide {
    BUY,
    SELL,
    /**
     * No-op decision. Never enters the book.
     */
    HOLD;

    public OrderSide opposite() {
        return switch (this) {
            case BUY -> SELL;
            case SELL -> BUY;
            case HOLD -> HOLD;
        };
    }
}
