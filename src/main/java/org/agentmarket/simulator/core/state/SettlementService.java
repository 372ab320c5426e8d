package org.agentmarket.simulator.core.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.Trade;
import org.agentmarket.simulator.core.population.PopulationManager;
import org.agentmarket.simulator.core.trader.MarketParticipant;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Applies a fill to the wallets of both counterparties.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {
    private final PopulationManager populationManager;

    public void settle(Trade trade) {
        apply(trade.getBuyerId(), OrderSide.BUY, trade);
        apply(trade.getSellerId(), OrderSide.SELL, trade);
    }

    private void apply(int participantId, OrderSide side, Trade trade) {
        Optional<MarketParticipant> participant = populationManager.getPopulation().findParticipant(participantId);
        if (participant.isEmpty()) {
            log.warn("Fill for unknown participant {} ({} {} @ {}), wallet not updated",
                    participantId, side, trade.getQuantity(), trade.getPrice());
            return;
        }
        MarketParticipant p = participant.get();
        p.applyFill(side, trade.getPrice(), trade.getQuantity());
        log.trace("Settled {} {} @ {} for {}: cash={}, position={}",
                side, trade.getQuantity(), trade.getPrice(), p, p.getCash(), p.getPosition());
    }
}
