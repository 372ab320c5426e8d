package org.agentmarket.simulator.core.event;

import lombok.Getter;
import org.agentmarket.simulator.core.model.Trade;
import org.springframework.context.ApplicationEvent;

@Getter
public class TradeExecutedEvent extends ApplicationEvent {
    private final Trade trade;

    public TradeExecutedEvent(Object source, Trade trade) {
        super(source);
        this.trade = trade;
    }
}
