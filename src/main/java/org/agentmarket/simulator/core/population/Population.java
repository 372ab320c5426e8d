package org.agentmarket.simulator.core.population;

import org.agentmarket.simulator.core.model.PopulationCounts;
import org.agentmarket.simulator.core.model.StrategyType;
import org.agentmarket.simulator.core.trader.MarketMaker;
import org.agentmarket.simulator.core.trader.MarketParticipant;
import org.agentmarket.simulator.core.trader.Trader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Traders in their fixed submission order plus the market makers, with id lookups for both.
 * Slots keep their id for the whole run; evolution only swaps the occupant.
 */
public class Population {
    private final List<Trader> traders = new ArrayList<>();
    private final Map<Integer, Trader> traderIndex = new HashMap<>();
    private final List<MarketMaker> marketMakers = new ArrayList<>();
    private final Map<Integer, MarketMaker> marketMakerIndex = new HashMap<>();

    public Population(List<? extends Trader> traders, List<MarketMaker> marketMakers) {
        for (Trader trader : traders) {
            if (traderIndex.putIfAbsent(trader.getId(), trader) != null) {
                throw new IllegalArgumentException("Duplicate trader id " + trader.getId());
            }
            this.traders.add(trader);
        }
        for (MarketMaker maker : marketMakers) {
            if (traderIndex.containsKey(maker.getId())
                    || marketMakerIndex.putIfAbsent(maker.getId(), maker) != null) {
                throw new IllegalArgumentException("Duplicate participant id " + maker.getId());
            }
            this.marketMakers.add(maker);
        }
    }

    public List<Trader> getTraders() {
        return Collections.unmodifiableList(traders);
    }

    public List<MarketMaker> getMarketMakers() {
        return Collections.unmodifiableList(marketMakers);
    }

    public Optional<Trader> findTrader(int id) {
        return Optional.ofNullable(traderIndex.get(id));
    }

    public Optional<MarketParticipant> findParticipant(int id) {
        Trader trader = traderIndex.get(id);
        if (trader != null) {
            return Optional.of(trader);
        }
        return Optional.ofNullable(marketMakerIndex.get(id));
    }

    /**
     * Puts a new occupant into an existing slot, both in the ordered collection and the lookup.
     */
    public void replace(Trader occupant) {
        int id = occupant.getId();
        if (!traderIndex.containsKey(id)) {
            throw new IllegalArgumentException("No population slot with id " + id);
        }
        traderIndex.put(id, occupant);
        for (int i = 0; i < traders.size(); i++) {
            if (traders.get(i).getId() == id) {
                traders.set(i, occupant);
                break;
            }
        }
    }

    public int size() {
        return traders.size();
    }

    public Map<StrategyType, Integer> countByStrategy() {
        Map<StrategyType, Integer> counts = new EnumMap<>(StrategyType.class);
        for (StrategyType strategy : StrategyType.values()) {
            counts.put(strategy, 0);
        }
        traders.forEach(t -> counts.merge(t.getStrategy(), 1, Integer::sum));
        counts.put(StrategyType.MARKET_MAKER, marketMakers.size());
        return counts;
    }

    public PopulationCounts counts(int tick) {
        Map<StrategyType, Integer> counts = countByStrategy();
        return PopulationCounts.builder()
                .tick(tick)
                .noise(counts.get(StrategyType.NOISE))
                .meanReverters(counts.get(StrategyType.MEAN_REVERTER))
                .momentum(counts.get(StrategyType.MOMENTUM))
                .marketMakers(counts.get(StrategyType.MARKET_MAKER))
                .build();
    }
}
