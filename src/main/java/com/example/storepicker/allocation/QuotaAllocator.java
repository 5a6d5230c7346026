package com.example.storepicker.allocation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a sample budget across strata.
 * <p>
 * Rules:
 * <ul>
 *   <li>no stratum gets more than its capacity</li>
 *   <li>the quotas never add up to more than the budget</li>
 *   <li>every non-empty stratum gets at least {@code minPerStratum} when the budget allows it</li>
 * </ul>
 * What is left after the minimum is spread proportionally to remaining capacity, with rounding
 * leftovers handed out one unit at a time.
 */
public final class QuotaAllocator {

    private QuotaAllocator() {
    }

    public static <K> Map<K, Integer> allocate(int total, Map<K, Integer> capacities) {
        return allocate(total, capacities, 1);
    }

    public static <K> Map<K, Integer> allocate(int total, Map<K, Integer> capacities, int minPerStratum) {
        // Drop empty strata
        Map<K, Integer> caps = new LinkedHashMap<>();
        for (Map.Entry<K, Integer> e : capacities.entrySet()) {
            if (e.getValue() != null && e.getValue() > 0) {
                caps.put(e.getKey(), e.getValue());
            }
        }
        List<K> keys = new ArrayList<>(caps.keySet());

        Map<K, Integer> alloc = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return alloc;
        }
        if (total <= 0) {
            keys.forEach(k -> alloc.put(k, 0));
            return alloc;
        }

        int min = Math.max(0, minPerStratum);
        long minTotal = (long) keys.size() * min;
        if (total < minTotal) {
            return evenSplit(total, caps, keys);
        }

        // Minimum first
        for (K k : keys) {
            alloc.put(k, Math.min(min, caps.get(k)));
        }
        long remaining = total - sum(alloc);
        if (remaining <= 0) {
            return alloc;
        }

        Map<K, Integer> remainingCapacity = new LinkedHashMap<>();
        long remainingTotal = 0;
        for (K k : keys) {
            int capRem = caps.get(k) - alloc.get(k);
            remainingCapacity.put(k, capRem);
            if (capRem > 0) {
                remainingTotal += capRem;
            }
        }
        if (remainingTotal <= 0) {
            return alloc;
        }

        // Proportional share of what is left, truncated
        Map<K, Integer> extra = new LinkedHashMap<>();
        long runningTotal = 0;
        for (K k : keys) {
            int capRem = remainingCapacity.get(k);
            if (capRem <= 0) {
                extra.put(k, 0);
                continue;
            }
            int add = (int) Math.min(remaining * capRem / remainingTotal, capRem);
            extra.put(k, add);
            runningTotal += add;
        }

        long leftover = remaining - runningTotal;
        if (leftover > 0) {
            List<K> byHeadroom = new ArrayList<>(keys);
            byHeadroom.sort(Comparator.comparingInt((K k) -> remainingCapacity.get(k) - extra.get(k)).reversed());
            int limit = byHeadroom.size() * 2;
            for (int i = 0; leftover > 0 && i < limit; i++) {
                K k = byHeadroom.get(i % byHeadroom.size());
                if (extra.get(k) < remainingCapacity.get(k)) {
                    extra.put(k, extra.get(k) + 1);
                    leftover--;
                }
            }
        }

        for (K k : keys) {
            alloc.put(k, alloc.get(k) + extra.get(k));
        }
        return alloc;
    }

    // Budget too small to give everyone the minimum: split evenly, then top up the largest strata.
    private static <K> Map<K, Integer> evenSplit(int total, Map<K, Integer> caps, List<K> keys) {
        int base = total / keys.size();
        Map<K, Integer> alloc = new LinkedHashMap<>();
        for (K k : keys) {
            alloc.put(k, Math.min(base, caps.get(k)));
        }

        List<K> bySize = new ArrayList<>(keys);
        bySize.sort(Comparator.comparingInt((K k) -> caps.get(k)).reversed());

        long allocated = sum(alloc);
        int limit = bySize.size() * 2;
        for (int i = 0; allocated < total && i < limit; i++) {
            K k = bySize.get(i % bySize.size());
            if (alloc.get(k) < caps.get(k)) {
                alloc.put(k, alloc.get(k) + 1);
                allocated++;
            }
        }
        return alloc;
    }

    private static <K> long sum(Map<K, Integer> values) {
        long s = 0;
        for (int v : values.values()) {
            s += v;
        }
        return s;
    }
}
