package polyopt.polyhedral.schedule;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.QuasiAffine;
import polyopt.polyhedral.affine.UnionSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The instance to time map of a schedule tree.
 */
public class ScheduleMap {
    // one step of a statement's path: a band to evaluate or a fixed branch position
    private static class Step {
        final BandNode band;
        final long position;
        final boolean unordered;

        Step(BandNode band_, long position_, boolean unordered_) {
            band = band_;
            position = position_;
            unordered = unordered_;
        }
    }

    private final UnionSet domain;
    private final Object2ObjectOpenHashMap<String, List<Step>> paths;
    private final Object2ObjectOpenHashMap<String, boolean[]> unorderedMasks;

    public ScheduleMap(DomainNode root) {
        domain = root.domain;
        paths = new Object2ObjectOpenHashMap<>();
        unorderedMasks = new Object2ObjectOpenHashMap<>();
        walk(root.child, new ArrayList<>(domain.names()), new ArrayList<>());
        for (String name : domain.names()) {
            List<Step> path = paths.get(name);
            if (path == null) {
                throw new ToolkitFailure("statement " + name + " reaches no leaf");
            }
            BooleanArrayList mask = new BooleanArrayList();
            for (Step step : path) {
                if (step.band == null) {
                    mask.add(step.unordered);
                } else {
                    for (int i = 0; i < step.band.dims(); ++i) {
                        mask.add(false);
                    }
                }
            }
            unorderedMasks.put(name, mask.toBooleanArray());
        }
    }

    private void walk(ScheduleNode node, List<String> active, List<Step> path) {
        switch (node.kind()) {
            case LEAF -> {
                for (String name : active) {
                    if (paths.put(name, new ArrayList<>(path)) != null) {
                        throw new ToolkitFailure("statement " + name + " reaches two leaves");
                    }
                }
            }
            case BAND -> {
                path.add(new Step((BandNode) node, 0, false));
                walk(node.child(0), active, path);
                path.remove(path.size() - 1);
            }
            case SEQUENCE, SET -> {
                boolean unordered = node.kind() == NodeKind.SET;
                for (int i = 0; i < node.childCount(); ++i) {
                    path.add(new Step(null, i, unordered));
                    walk(node.child(i), active, path);
                    path.remove(path.size() - 1);
                }
            }
            case FILTER -> {
                List<String> filtered = new ArrayList<>(active);
                filtered.retainAll(((FilterNode) node).statements);
                walk(node.child(0), filtered, path);
            }
            case DOMAIN -> walk(node.child(0), active, path);
        }
    }

    public TimeVector time(Instance instance, Map<String, Long> params) {
        List<Step> path = paths.get(instance.name);
        boolean[] mask = unorderedMasks.get(instance.name);
        Map<String, Long> values = new HashMap<>(params);
        List<String> dims = domain.get(instance.name).dims;
        for (int i = 0; i < dims.size(); ++i) {
            values.put(dims.get(i), instance.point[i]);
        }
        long[] result = new long[mask.length];
        int k = 0;
        for (Step step : path) {
            if (step.band == null) {
                result[k++] = step.position;
                continue;
            }
            for (var dim : step.band.schedule.dims) {
                QuasiAffine expr = dim.get(instance.name).expr;
                result[k++] = expr.evaluate(values);
            }
        }
        return new TimeVector(result, mask);
    }

    public TimeVector[] times(List<Instance> instances, Map<String, Long> params) {
        TimeVector[] result = new TimeVector[instances.size()];
        for (Instance instance : instances) {
            result[instance.id] = time(instance, params);
        }
        return result;
    }

    /**
     * Number of time vector entries above the node at {@code cursor}, which is
     * the same for every statement reaching it.
     */
    public static int depthOf(ScheduleCursor cursor) {
        int depth = 0;
        for (int level = 0; level < cursor.depth(); ++level) {
            ScheduleNode node = cursor.ancestor(level);
            if (node instanceof BandNode band) {
                depth += band.dims();
            } else if (node.kind() == NodeKind.SEQUENCE || node.kind() == NodeKind.SET) {
                depth += 1;
            }
        }
        return depth;
    }
}
