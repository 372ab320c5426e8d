package org.agentmarket.simulator.core.event;

import lombok.Getter;
import org.agentmarket.simulator.core.model.TickResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per tick after the tick snapshot is appended. Exporters subscribe to this.
 */
@Getter
public class TickCompletedEvent extends ApplicationEvent {
    private final TickResult result;

    public TickCompletedEvent(Object source, TickResult result) {
        super(source);
        this.result = result;
    }
}
