package org.agentmarket.simulator.core.matching;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.event.TradeExecutedEvent;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.PriceLevel;
import org.agentmarket.simulator.core.model.Trade;
import org.agentmarket.simulator.core.orderbook.OrderBookManager;
import org.agentmarket.simulator.core.state.SettlementService;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Crosses each incoming order against the resting book with price-time priority.
 * The resting order sets the trade price; whatever is left of the incoming order rests
 * at the back of its level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContinuousMatchingEngine {
    private final OrderBookManager orderBookManager;
    private final SettlementService settlementService;
    private final ApplicationEventPublisher eventPublisher;
    private final SimulatorProperties properties;

    public List<Trade> submit(Order incoming, int currentTick) {
        if (incoming.isHold() || incoming.isExhausted()) {
            log.trace("MATCHING: trader {} holds at tick {}", incoming.getTraderId(), currentTick);
            return Collections.emptyList();
        }

        log.debug("MATCHING: {} {} @ {} qty={} from trader {} [{}]",
                incoming.getSide(), incoming.getStrategy(), incoming.getPrice(), incoming.getQuantity(),
                incoming.getTraderId(), currentTick);

        Order remaining = incoming.copy();
        List<Trade> trades = new ArrayList<>();
        int maxOrderAge = properties.getMarket().getMaxOrderAge();

        orderBookManager.getLock().writeLock().lock();
        try {
            NavigableMap<Double, PriceLevel> opposite = orderBookManager.getSide(remaining.getSide().opposite());

            while (!remaining.isExhausted() && !opposite.isEmpty()) {
                Map.Entry<Double, PriceLevel> best = opposite.firstEntry();
                if (!crosses(remaining, best.getKey())) {
                    break;
                }
                PriceLevel level = best.getValue();
                Order resting = level.peekFirst();

                if (resting.getTraderId() == remaining.getTraderId()) {
                    log.debug("MATCHING: discarding resting order of trader {} @ {} (self-trade)",
                            resting.getTraderId(), resting.getPrice());
                    discardHead(opposite, level);
                    continue;
                }
                if (currentTick - resting.getSubmittedAtTick() > maxOrderAge) {
                    log.debug("MATCHING: discarding resting order of trader {} @ {} (expired, submitted at {})",
                            resting.getTraderId(), resting.getPrice(), resting.getSubmittedAtTick());
                    discardHead(opposite, level);
                    continue;
                }

                double quantity = Math.min(remaining.getQuantity(), resting.getQuantity());
                Trade trade = buildTrade(remaining, resting, quantity, currentTick);

                settlementService.settle(trade);
                resting.fill(quantity);
                remaining.fill(quantity);
                trades.add(trade);

                log.debug("TRADE: buyer={} [{}] seller={} [{}] {} @ {}",
                        trade.getBuyerId(), trade.getBuyerStrategy(), trade.getSellerId(), trade.getSellerStrategy(),
                        trade.getQuantity(), trade.getPrice());
                eventPublisher.publishEvent(new TradeExecutedEvent(this, trade));

                // A partially filled resting order keeps its place at the head of the level.
                if (resting.isExhausted()) {
                    discardHead(opposite, level);
                }
            }

            if (!remaining.isExhausted()) {
                log.trace("MATCHING: resting {} qty={} @ {} for trader {}",
                        remaining.getSide(), remaining.getQuantity(), remaining.getPrice(), remaining.getTraderId());
                orderBookManager.addOrder(remaining);
            }
        } finally {
            orderBookManager.getLock().writeLock().unlock();
        }

        return trades;
    }

    private static boolean crosses(Order incoming, double restingPrice) {
        return incoming.getSide() == OrderSide.BUY
                ? restingPrice <= incoming.getPrice()
                : restingPrice >= incoming.getPrice();
    }

    private static void discardHead(NavigableMap<Double, PriceLevel> side, PriceLevel level) {
        level.pollFirst();
        if (level.isEmpty()) {
            side.remove(level.getPrice());
        }
    }

    private static Trade buildTrade(Order incoming, Order resting, double quantity, int tick) {
        boolean incomingBuys = incoming.getSide() == OrderSide.BUY;
        Order buyer = incomingBuys ? incoming : resting;
        Order seller = incomingBuys ? resting : incoming;
        return Trade.builder()
                .price(resting.getPrice())
                .quantity(quantity)
                .buyerId(buyer.getTraderId())
                .sellerId(seller.getTraderId())
                .tick(tick)
                .buyerStrategy(buyer.getStrategy())
                .sellerStrategy(seller.getStrategy())
                .aggressorSide(incoming.getSide())
                .build();
    }
}
