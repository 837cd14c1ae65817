package polyopt.polyhedral.affine;

import polyopt.Util.error.ToolkitFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjoint union of statement domains, keyed by statement name.
 */
public class UnionSet {
    public final List<String> params;
    private final LinkedHashMap<String, BasicSet> table = new LinkedHashMap<>();
    public final Map<String, BasicSet> sets = Collections.unmodifiableMap(table);

    public UnionSet(List<String> params_, Collection<BasicSet> sets_) {
        params = List.copyOf(params_);
        for (BasicSet set : sets_) {
            if (table.containsKey(set.name)) {
                throw new ToolkitFailure("duplicate tuple " + set.name);
            }
            table.put(set.name, set);
        }
    }

    public BasicSet get(String name) {
        var set = sets.get(name);
        if (set == null) {
            throw new ToolkitFailure("unknown statement " + name);
        }
        return set;
    }

    public boolean contains(String name) {
        return sets.containsKey(name);
    }

    public Set<String> names() {
        return sets.keySet();
    }

    public UnionSet restrict(Collection<String> names) {
        List<BasicSet> result = new ArrayList<>();
        for (var set : sets.values()) {
            if (names.contains(set.name)) {
                result.add(set);
            }
        }
        return new UnionSet(params, result);
    }

    static String paramsPrefix(List<String> params) {
        return params.isEmpty() ? "" : "[" + String.join(", ", params) + "] -> ";
    }

    /**
     * {@code { S_0[i]; S_1[i, j] }}: the tuples without their constraints, as
     * a filter prints them.
     */
    public static String filterString(Collection<String> names, UnionSet domain) {
        List<String> tuples = new ArrayList<>();
        for (var set : domain.sets.values()) {
            if (names.contains(set.name)) {
                tuples.add(set.tupleString());
            }
        }
        return "{ " + String.join("; ", tuples) + " }";
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (var set : sets.values()) {
            parts.add(set.toString());
        }
        return paramsPrefix(params) + "{ " + String.join("; ", parts) + " }";
    }
}
