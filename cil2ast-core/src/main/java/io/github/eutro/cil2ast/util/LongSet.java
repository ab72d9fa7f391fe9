package io.github.eutro.cil2ast.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable set of {@code long}s, stored as sorted, disjoint, non-adjacent closed intervals.
 */
public final class LongSet implements ValueSet<LongSet> {
    public static final LongSet EMPTY = new LongSet(Collections.emptyList());
    public static final LongSet UNIVERSE = new LongSet(Collections.singletonList(new long[]{Long.MIN_VALUE, Long.MAX_VALUE}));

    private final List<long[]> intervals;

    private LongSet(List<long[]> intervals) {
        this.intervals = intervals;
    }

    public static LongSet of(long value) {
        return range(value, value);
    }

    /**
     * Get the set of values in a closed interval.
     *
     * @param start The least value.
     * @param end   The greatest value.
     * @return The set, empty if {@code start > end}.
     */
    public static LongSet range(long start, long end) {
        if (start > end) return EMPTY;
        return new LongSet(Collections.singletonList(new long[]{start, end}));
    }

    public static LongSet atLeast(long value) {
        return range(value, Long.MAX_VALUE);
    }

    public static LongSet atMost(long value) {
        return range(Long.MIN_VALUE, value);
    }

    @Override
    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean isUniverse() {
        return equals(UNIVERSE);
    }

    public boolean contains(long value) {
        for (long[] interval : intervals) {
            if (interval[0] <= value && value <= interval[1]) return true;
        }
        return false;
    }

    /**
     * Count the values in this set, saturating at {@link Long#MAX_VALUE}.
     *
     * @return The number of values.
     */
    public long count() {
        long count = 0;
        for (long[] interval : intervals) {
            long size = interval[1] - interval[0] + 1;
            if (size <= 0 || count + size < count) return Long.MAX_VALUE;
            count += size;
        }
        return count;
    }

    /**
     * Get the number of maximal intervals this set consists of.
     *
     * @return The interval count.
     */
    public int intervalCount() {
        return intervals.size();
    }

    /**
     * Get the intervals of this set, each as a two element array {@code {start, end}}.
     *
     * @return The intervals, in ascending order.
     */
    public List<long[]> intervals() {
        List<long[]> copy = new ArrayList<>(intervals.size());
        for (long[] interval : intervals) {
            copy.add(interval.clone());
        }
        return copy;
    }

    /**
     * Get the values of this set, which must be small.
     *
     * @return The values in ascending order.
     * @throws IllegalStateException If the set has more than {@link Integer#MAX_VALUE} elements.
     */
    public List<Long> values() {
        long count = count();
        if (count > Integer.MAX_VALUE) throw new IllegalStateException("set too large to enumerate");
        List<Long> values = new ArrayList<>((int) count);
        for (long[] interval : intervals) {
            for (long v = interval[0]; ; v++) {
                values.add(v);
                if (v == interval[1]) break;
            }
        }
        return values;
    }

    public long min() {
        if (intervals.isEmpty()) throw new IllegalStateException("empty set");
        return intervals.get(0)[0];
    }

    @Override
    public LongSet invert() {
        List<long[]> result = new ArrayList<>();
        long next = Long.MIN_VALUE;
        boolean open = true;
        for (long[] interval : intervals) {
            if (interval[0] > next) {
                result.add(new long[]{next, interval[0] - 1});
            }
            if (interval[1] == Long.MAX_VALUE) {
                open = false;
                break;
            }
            next = interval[1] + 1;
        }
        if (open) result.add(new long[]{next, Long.MAX_VALUE});
        return new LongSet(result);
    }

    @Override
    public LongSet union(LongSet other) {
        List<long[]> all = new ArrayList<>(intervals);
        all.addAll(other.intervals);
        all.sort((a, b) -> Long.compare(a[0], b[0]));
        List<long[]> result = new ArrayList<>();
        for (long[] interval : all) {
            if (!result.isEmpty()) {
                long[] last = result.get(result.size() - 1);
                if (last[1] == Long.MAX_VALUE || interval[0] <= last[1] + 1) {
                    if (interval[1] > last[1]) last[1] = interval[1];
                    continue;
                }
            }
            result.add(interval.clone());
        }
        return new LongSet(result);
    }

    @Override
    public LongSet intersect(LongSet other) {
        List<long[]> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < intervals.size() && j < other.intervals.size()) {
            long[] a = intervals.get(i);
            long[] b = other.intervals.get(j);
            long start = Math.max(a[0], b[0]);
            long end = Math.min(a[1], b[1]);
            if (start <= end) result.add(new long[]{start, end});
            if (a[1] < b[1]) {
                i++;
            } else {
                j++;
            }
        }
        return new LongSet(result);
    }

    @Override
    public LongSet except(LongSet other) {
        return intersect(other.invert());
    }

    /**
     * Add a constant to every value, dropping values that would overflow.
     *
     * @param offset The offset.
     * @return The shifted set.
     */
    public LongSet shift(long offset) {
        if (offset == 0) return this;
        List<long[]> result = new ArrayList<>();
        for (long[] interval : intervals) {
            long start = interval[0];
            long end = interval[1];
            if (offset > 0) {
                if (start > Long.MAX_VALUE - offset) continue;
                end = end > Long.MAX_VALUE - offset ? Long.MAX_VALUE : end + offset;
                start += offset;
            } else {
                if (end < Long.MIN_VALUE - offset) continue;
                start = start < Long.MIN_VALUE - offset ? Long.MIN_VALUE : start + offset;
                end += offset;
            }
            result.add(new long[]{start, end});
        }
        return new LongSet(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LongSet that = (LongSet) o;
        if (intervals.size() != that.intervals.size()) return false;
        for (int i = 0; i < intervals.size(); i++) {
            long[] a = intervals.get(i);
            long[] b = that.intervals.get(i);
            if (a[0] != b[0] || a[1] != b[1]) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (long[] interval : intervals) {
            hash = 31 * hash + Long.hashCode(interval[0]);
            hash = 31 * hash + Long.hashCode(interval[1]);
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < intervals.size(); i++) {
            if (i != 0) sb.append(", ");
            long[] interval = intervals.get(i);
            if (interval[0] == interval[1]) {
                sb.append(interval[0]);
            } else {
                sb.append('[').append(interval[0]).append("..").append(interval[1]).append(']');
            }
        }
        return sb.append('}').toString();
    }
}
