package org.agentmarket.simulator.core.orderbook;

import lombok.extern.slf4j.Slf4j;
import org.agentmarket.simulator.core.model.Order;
import org.agentmarket.simulator.core.model.OrderBook;
import org.agentmarket.simulator.core.model.OrderSide;
import org.agentmarket.simulator.core.model.PriceLevel;
import org.agentmarket.simulator.core.model.StrategyType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Owns the resting orders of the single simulated asset. Mutations happen on the tick loop;
 * the read lock lets reporting code query the book from other threads.
 */
@Slf4j
@Service
public class OrderBookManager {
    private final OrderBook orderBook = new OrderBook();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public void clear() {
        lock.writeLock().lock();
        try {
            orderBook.getBids().clear();
            orderBook.getAsks().clear();
            log.info("OrderBook cleared");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends the order at the back of its price level. The book keeps the instance it is given.
     */
    public void addOrder(Order order) {
        if (order.isHold() || order.isExhausted()) {
            log.debug("Rejected non-restable order from trader {}: side={}, qty={}",
                    order.getTraderId(), order.getSide(), order.getQuantity());
            return;
        }
        lock.writeLock().lock();
        try {
            NavigableMap<Double, PriceLevel> side = orderBook.side(order.getSide());
            side.computeIfAbsent(order.getPrice(), PriceLevel::new).addOrder(order);
            log.trace("Added {} order of trader {} to level {} qty={}",
                    order.getSide(), order.getTraderId(), order.getPrice(), order.getQuantity());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every resting order matching the filter, dropping levels that become empty.
     *
     * @return number of orders removed
     */
    public int removeOrders(Predicate<Order> filter) {
        lock.writeLock().lock();
        try {
            return removeFromSide(orderBook.getBids(), filter) + removeFromSide(orderBook.getAsks(), filter);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int removeOrders(StrategyType strategy) {
        int removed = removeOrders(order -> order.getStrategy() == strategy);
        log.debug("Removed {} resting {} orders", removed, strategy);
        return removed;
    }

    private int removeFromSide(NavigableMap<Double, PriceLevel> side, Predicate<Order> filter) {
        int removed = 0;
        Iterator<Map.Entry<Double, PriceLevel>> levels = side.entrySet().iterator();
        while (levels.hasNext()) {
            PriceLevel level = levels.next().getValue();
            removed += level.removeIf(filter);
            if (level.isEmpty()) {
                levels.remove();
            }
        }
        return removed;
    }

    public List<Order> getOrders(int traderId) {
        lock.readLock().lock();
        try {
            List<Order> result = new ArrayList<>();
            for (NavigableMap<Double, PriceLevel> side : List.of(orderBook.getBids(), orderBook.getAsks())) {
                side.values().forEach(level -> level.getOrders().stream()
                        .filter(o -> o.getTraderId() == traderId)
                        .forEach(result::add));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getOrderCount() {
        lock.readLock().lock();
        try {
            return countOrders(orderBook.getBids()) + countOrders(orderBook.getAsks());
        } finally {
            lock.readLock().unlock();
        }
    }

    private int countOrders(NavigableMap<Double, PriceLevel> side) {
        return side.values().stream().mapToInt(PriceLevel::size).sum();
    }

    /**
     * Copy of the top {@code depth} levels of each side. Orders in the copy are copies too.
     */
    public OrderBook getSnapshot(int depth) {
        lock.readLock().lock();
        try {
            OrderBook snapshot = new OrderBook();
            fillSnapshotSide(orderBook.getBids(), snapshot.getBids(), depth);
            fillSnapshotSide(orderBook.getAsks(), snapshot.getAsks(), depth);
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void fillSnapshotSide(NavigableMap<Double, PriceLevel> source,
                                  NavigableMap<Double, PriceLevel> target,
                                  int depth) {
        source.entrySet().stream()
                .limit(depth)
                .forEach(entry -> {
                    PriceLevel snapshotLevel = new PriceLevel(entry.getKey());
                    entry.getValue().getOrders().forEach(o -> snapshotLevel.addOrder(o.copy()));
                    target.put(entry.getKey(), snapshotLevel);
                });
    }

    public Double getBestBid() {
        lock.readLock().lock();
        try {
            return orderBook.getBids().isEmpty() ? null : orderBook.getBids().firstKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Double getBestAsk() {
        lock.readLock().lock();
        try {
            return orderBook.getAsks().isEmpty() ? null : orderBook.getAsks().firstKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True when both sides are non-empty and the best bid is not strictly below the best ask.
     * A crossed book after a matching pass means the matching algorithm is broken.
     */
    public boolean isCrossed() {
        Double bid = getBestBid();
        Double ask = getBestAsk();
        return bid != null && ask != null && bid >= ask;
    }

    public NavigableMap<Double, PriceLevel> getSide(OrderSide side) {
        return orderBook.side(side);
    }

    public NavigableMap<Double, PriceLevel> getBids() {
        return orderBook.getBids();
    }

    public NavigableMap<Double, PriceLevel> getAsks() {
        return orderBook.getAsks();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
