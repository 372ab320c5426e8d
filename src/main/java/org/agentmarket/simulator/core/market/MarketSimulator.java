package org.agentmarket.simulator.core.market;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.config.SimulatorProperties;
import org.agentmarket.simulator.core.event.TickCompletedEvent;
import org.agentmarket.simulator.core.matching.ContinuousMatchingEngine;
import org.agentmarket.simulator.core.model.EvolutionOutcome;
import org.agentmarket.simulator.core.model.MarketTick;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.PopulationCounts;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.model.TickResult;
import org.agentmarket.simulator.core.model.Trade;
import org.agentmarket.simulator.core.model.WalletSnapshot;
import org.agentmarket.simulator.core.orderbook.OrderBookManager;
import org.agentmarket.simulator.core.population.EvolutionManager;
import org.agentmarket.simulator.core.population.Population;
import org.agentmarket.simulator.core.population.PopulationManager;
import org.agentmarket.simulator.core.trader.MarketMaker;
import org.agentmarket.simulator.core.trader.MarketParticipant;
import org.agentmarket.simulator.core.trader.Trader;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Drives the market one tick at a time and answers queries about its state.
 * <p>
 * A tick purges the makers' previous quotes, posts fresh maker quotes, lets every trader submit
 * one order in population order, advances the clock, runs evolution when due and finally
 * appends the tick snapshot. The caller decides how many ticks to run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketSimulator {
    private final SimulatorProperties properties;
    private final OrderBookManager orderBookManager;
    private final ContinuousMatchingEngine matchingEngine;
    private final PopulationManager populationManager;
    private final EvolutionManager evolutionManager;
    private final ApplicationEventPublisher eventPublisher;

    private final List<MarketTick> tickHistory = new ArrayList<>();
    private final List<Trade> tradeLog = new ArrayList<>();
    private final List<PopulationCounts> countsHistory = new ArrayList<>();

    private double marketPrice;
    private int currentTick;

    @PostConstruct
    public void init() {
        validate();
        marketPrice = properties.getMarket().getInitialPrice();
        currentTick = 0;
        countsHistory.add(populationManager.getPopulation().counts(0));
        log.info("Market initialized: price={}, maxOrderAge={}, evolution={} every {} ticks (kill {})",
                marketPrice, properties.getMarket().getMaxOrderAge(),
                properties.getEvolution().isEnabled(), properties.getEvolution().getIntervalTicks(),
                properties.getEvolution().getKillPercentage());
    }

    public synchronized TickResult tick() {
        Population population = populationManager.getPopulation();
        List<Trade> tickTrades = new ArrayList<>();

        orderBookManager.removeOrders(StrategyType.MARKET_MAKER);

        for (MarketMaker maker : population.getMarketMakers()) {
            for (Order quote : maker.quote(marketPrice, currentTick)) {
                process(quote, tickTrades);
            }
        }

        List<MarketTick> history = Collections.unmodifiableList(tickHistory);
        for (Trader trader : population.getTraders()) {
            Order order = trader.decide(marketPrice, orderBookManager.getBestBid(), orderBookManager.getBestAsk(),
                    history, currentTick);
            process(order, tickTrades);
        }

        currentTick++;

        boolean evolved = false;
        Optional<EvolutionOutcome> outcome = evolutionManager.evolveIfDue(currentTick, marketPrice);
        if (outcome.isPresent()) {
            countsHistory.add(outcome.get().getCounts());
            evolved = true;
        }

        MarketTick snapshot = buildTick(tickTrades);
        tickHistory.add(snapshot);
        tradeLog.addAll(tickTrades);
        applyRetention();

        if (orderBookManager.isCrossed()) {
            log.error("Crossed book after tick {}: bid={} ask={}",
                    currentTick, orderBookManager.getBestBid(), orderBookManager.getBestAsk());
        }

        TickResult result = TickResult.builder()
                .tick(snapshot)
                .trades(List.copyOf(tickTrades))
                .counts(population.counts(currentTick))
                .volumeByStrategy(volumeByTakerStrategy(tickTrades))
                .evolved(evolved)
                .build();
        log.trace("Tick {} done: price={} volume={} vwap={} mid={}",
                currentTick, snapshot.getLastTradePrice(), snapshot.getVolume(), snapshot.getVwap(), snapshot.getMidPrice());
        eventPublisher.publishEvent(new TickCompletedEvent(this, result));
        return result;
    }

    private void process(Order order, List<Trade> tickTrades) {
        List<Trade> trades = matchingEngine.submit(order, currentTick);
        if (!trades.isEmpty()) {
            marketPrice = trades.get(trades.size() - 1).getPrice();
            tickTrades.addAll(trades);
        }
    }

    private MarketTick buildTick(List<Trade> trades) {
        double volume = trades.stream().mapToDouble(Trade::getQuantity).sum();
        double notional = trades.stream().mapToDouble(Trade::getNotional).sum();
        double vwap = volume > 0.0 ? notional / volume : marketPrice;
        return MarketTick.builder()
                .lastTradePrice(marketPrice)
                .volume(volume)
                .vwap(vwap)
                .midPrice(midPrice())
                .tick(currentTick)
                .build();
    }

    /**
     * Mid of the book extremes. Falls back to the only populated side, then to the last trade price.
     */
    private double midPrice() {
        Double bid = orderBookManager.getBestBid();
        Double ask = orderBookManager.getBestAsk();
        if (bid != null && ask != null) {
            return (bid + ask) / 2.0;
        }
        if (bid != null) {
            return bid;
        }
        if (ask != null) {
            return ask;
        }
        return marketPrice;
    }

    // The trade log is cleared on a fixed schedule; tick history keeps a sliding window.
    private void applyRetention() {
        int limit = properties.getMarket().getTickHistoryLimit();
        if (tickHistory.size() > limit) {
            tickHistory.subList(0, tickHistory.size() - limit).clear();
        }
        int flushInterval = properties.getMarket().getTradeLogFlushInterval();
        if (flushInterval > 0 && currentTick % flushInterval == 0) {
            log.debug("Flushing trade log at tick {} ({} trades)", currentTick, tradeLog.size());
            tradeLog.clear();
        }
    }

    // Volume is attributed to the strategy of the incoming order.
    private static Map<StrategyType, Double> volumeByTakerStrategy(List<Trade> trades) {
        Map<StrategyType, Double> volume = new EnumMap<>(StrategyType.class);
        for (Trade trade : trades) {
            volume.merge(trade.getTakerStrategy(), trade.getQuantity(), Double::sum);
        }
        return volume;
    }

    public synchronized double getMarketPrice() {
        return marketPrice;
    }

    public synchronized int getCurrentTick() {
        return currentTick;
    }

    public Double getBestBid() {
        return orderBookManager.getBestBid();
    }

    public Double getBestAsk() {
        return orderBookManager.getBestAsk();
    }

    public synchronized Optional<WalletSnapshot> getWallet(int participantId) {
        return populationManager.getPopulation().findParticipant(participantId).map(this::toSnapshot);
    }

    public synchronized Optional<Double> getValue(int participantId) {
        return populationManager.getPopulation().findParticipant(participantId).map(p -> p.getValue(marketPrice));
    }

    /**
     * Traders ranked by mark-to-market value, best first.
     */
    public synchronized List<WalletSnapshot> getStandings() {
        return populationManager.getPopulation().getTraders().stream()
                .map(this::toSnapshot)
                .sorted(Comparator.comparingDouble(WalletSnapshot::getMarkToMarketValue).reversed())
                .collect(Collectors.toList());
    }

    public synchronized Map<StrategyType, Double> getAverageValueByStrategy() {
        return populationManager.getPopulation().getTraders().stream()
                .collect(Collectors.groupingBy(Trader::getStrategy,
                        () -> new EnumMap<>(StrategyType.class),
                        Collectors.averagingDouble(t -> t.getValue(marketPrice))));
    }

    public synchronized List<MarketTick> getTickHistory() {
        return List.copyOf(tickHistory);
    }

    public synchronized Optional<MarketTick> getLastTick() {
        return tickHistory.isEmpty() ? Optional.empty() : Optional.of(tickHistory.get(tickHistory.size() - 1));
    }

    public synchronized List<Trade> getTradeLog() {
        return List.copyOf(tradeLog);
    }

    public synchronized List<PopulationCounts> getCountsHistory() {
        return List.copyOf(countsHistory);
    }

    public synchronized PopulationCounts getPopulationCounts() {
        return populationManager.getPopulation().counts(currentTick);
    }

    private WalletSnapshot toSnapshot(MarketParticipant participant) {
        String sizing = participant instanceof Trader
                ? ((Trader) participant).getSizer().getMethod().getLabel()
                : "none";
        return WalletSnapshot.builder()
                .traderId(participant.getId())
                .strategy(participant.getStrategy())
                .sizingMethod(sizing)
                .cash(participant.getCash())
                .position(participant.getPosition())
                .markToMarketValue(participant.getValue(marketPrice))
                .build();
    }

    private void validate() {
        SimulatorProperties.Market market = properties.getMarket();
        SimulatorProperties.Evolution evolution = properties.getEvolution();
        if (market.getInitialPrice() <= 0) {
            throw new IllegalArgumentException("market.initial-price must be positive: " + market.getInitialPrice());
        }
        if (market.getMaxOrderAge() < 0) {
            throw new IllegalArgumentException("market.max-order-age must not be negative: " + market.getMaxOrderAge());
        }
        if (market.getTickHistoryLimit() <= 0) {
            throw new IllegalArgumentException("market.tick-history-limit must be positive");
        }
        if (evolution.getKillPercentage() < 0 || evolution.getKillPercentage() > 1) {
            throw new IllegalArgumentException("evolution.kill-percentage must be within [0, 1]: "
                    + evolution.getKillPercentage());
        }
        if (evolution.isEnabled() && evolution.getIntervalTicks() <= 0) {
            throw new IllegalArgumentException("evolution.interval-ticks must be positive when evolution is enabled");
        }
    }
}
