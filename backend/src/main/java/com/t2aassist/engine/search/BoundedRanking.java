package com.t2aassist.engine.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the best {@code capacity} elements offered, under a total order where
 * "smaller" means "better". Every candidate is compared, so truncation never
 * depends on the order candidates arrive in.
 */
final class BoundedRanking<T> {

    private static final int INITIAL_CAPACITY = 64;

    private final int capacity;
    private final Comparator<T> order;
    private final PriorityQueue<T> worstFirst;

    BoundedRanking(int capacity, Comparator<T> order) {
        this.capacity = capacity;
        this.order = order;
        this.worstFirst = new PriorityQueue<>(Math.min(capacity, INITIAL_CAPACITY) + 1, order.reversed());
    }

    void offer(T candidate) {
        worstFirst.offer(candidate);
        if (worstFirst.size() > capacity) {
            worstFirst.poll();
        }
    }

    List<T> toSortedList() {
        List<T> result = new ArrayList<>(worstFirst);
        result.sort(order);
        return result;
    }
}
