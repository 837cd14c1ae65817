package polyopt.polyhedral.schedule;

import java.util.Arrays;

/**
 * Execution date of an instance: band values and branch positions along its
 * path through the tree. {@code unordered[k]} marks entries that come from a
 * set node, where different values impose no order.
 */
public class TimeVector {
    public final long[] values;
    public final boolean[] unordered;

    public TimeVector(long[] values_, boolean[] unordered_) {
        values = values_;
        unordered = unordered_;
    }

    /**
     * True when {@code this} is executed strictly before {@code other}.
     */
    public boolean precedes(TimeVector other) {
        int n = Math.min(values.length, other.values.length);
        for (int k = 0; k < n; ++k) {
            if (values[k] != other.values[k]) {
                return !unordered[k] && values[k] < other.values[k];
            }
        }
        return false;
    }

    /**
     * Lexicographic order that ignores the unordered marks.
     */
    public static int compare(TimeVector a, TimeVector b) {
        int n = Math.min(a.values.length, b.values.length);
        for (int k = 0; k < n; ++k) {
            if (a.values[k] != b.values[k]) {
                return Long.compare(a.values[k], b.values[k]);
            }
        }
        return Integer.compare(a.values.length, b.values.length);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
