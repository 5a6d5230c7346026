package com.example.storepicker.strata;

import java.util.List;

/**
 * Normalized attribute values identifying a stratum. Equality is element-wise; ordering is
 * lexicographic over the elements, shorter keys first on a shared prefix.
 */
public final class StratumKey implements Comparable<StratumKey> {

    private final List<String> values;

    /**
     * @throws NullPointerException if any value is {@code null}
     */
    public StratumKey(List<String> values) {
        this.values = List.copyOf(values);
    }

    public static StratumKey of(String... values) {
        return new StratumKey(List.of(values));
    }

    public List<String> values() {
        return values;
    }

    @Override
    public int compareTo(StratumKey other) {
        int n = Math.min(values.size(), other.values.size());
        for (int i = 0; i < n; i++) {
            int c = values.get(i).compareTo(other.values.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StratumKey)) return false;
        return values.equals(((StratumKey) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" | ", values);
    }
}
