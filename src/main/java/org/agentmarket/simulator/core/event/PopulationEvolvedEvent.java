package org.agentmarket.simulator.core.event;

import lombok.Getter;
import org.agentmarket.simulator.core.model.EvolutionOutcome;
import org.springframework.context.ApplicationEvent;

@Getter
public class PopulationEvolvedEvent extends ApplicationEvent {
    private final EvolutionOutcome outcome;

    public PopulationEvolvedEvent(Object source, EvolutionOutcome outcome) {
        super(source);
        this.outcome = outcome;
    }
}
