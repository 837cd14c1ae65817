package polyopt.polyhedral.dependency;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.EnumMap;

/**
 * Ordered pairs of instance ids (source executes first in the original
 * program). Built once, read-only afterwards.
 */
public class DependenceRelation {
    private final LongArrayList pairs;
    private final LongOpenHashSet seen;
    private final EnumMap<Dependency, Integer> counts;
    private boolean released;

    public DependenceRelation() {
        pairs = new LongArrayList();
        seen = new LongOpenHashSet();
        counts = new EnumMap<>(Dependency.class);
        for (Dependency kind : Dependency.values()) {
            counts.put(kind, 0);
        }
    }

    void add(int source, int target, Dependency kind) {
        long key = ((long) source << 32) | (target & 0xffffffffL);
        if (seen.add(key)) {
            pairs.add(key);
            counts.merge(kind, 1, Integer::sum);
        }
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    public int source(int pos) {
        return (int) (pairs.getLong(pos) >>> 32);
    }

    public int target(int pos) {
        return (int) pairs.getLong(pos);
    }

    public boolean contains(int source, int target) {
        return seen.contains(((long) source << 32) | (target & 0xffffffffL));
    }

    /**
     * Pairs first recorded as {@code kind}; a pair that is also of another
     * kind is counted once.
     */
    public int count(Dependency kind) {
        return counts.get(kind);
    }

    public void release() {
        pairs.clear();
        pairs.trim();
        seen.clear();
        seen.trim();
        released = true;
    }

    public boolean released() {
        return released;
    }

    @Override
    public String toString() {
        return size() + " dependences (flow " + count(Dependency.FLOW) + ", anti " + count(Dependency.ANTI)
                + ", output " + count(Dependency.OUTPUT) + ")";
    }
}
