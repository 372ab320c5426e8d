package org.agentmarket.simulator.core.model;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * FIFO queue of resting orders at one price.
 */
public class PriceLevel {
    @Getter
    private final double price;
    private final Deque<Order> orders = new ArrayDeque<>();

    public PriceLevel(double price) {
        this.price = price;
    }

    public void addOrder(Order order) {
        orders.addLast(order);
    }

    public Order peekFirst() {
        return orders.peekFirst();
    }

    public Order pollFirst() {
        return orders.pollFirst();
    }

    public int removeIf(Predicate<Order> filter) {
        int before = orders.size();
        orders.removeIf(filter);
        return before - orders.size();
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public int size() {
        return orders.size();
    }

    public double getTotalQuantity() {
        return orders.stream()
                .mapToDouble(Order::getQuantity)
                .sum();
    }

    /**
     * Orders in queue order (earliest first).
     */
    public List<Order> getOrders() {
        return new ArrayList<>(orders);
    }
}
