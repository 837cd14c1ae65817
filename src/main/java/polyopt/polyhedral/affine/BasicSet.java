package polyopt.polyhedral.affine;

import polyopt.Util.error.ToolkitFailure;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Integer points of one statement tuple {@code name[dims]} satisfying a
 * conjunction of constraints over the dims and the parameters.
 */
public class BasicSet {
    public final String name;
    public final List<String> dims;
    public final List<String> params;
    public final List<Constrain> constrains;

    public BasicSet(String name_, List<String> dims_, List<String> params_, List<Constrain> constrains_) {
        name = name_;
        dims = List.copyOf(dims_);
        params = List.copyOf(params_);
        constrains = List.copyOf(constrains_);
    }

    public boolean contains(long[] point, Map<String, Long> paramValues) {
        Map<String, Long> values = new HashMap<>(paramValues);
        for (int i = 0; i < dims.size(); ++i) {
            values.put(dims.get(i), point[i]);
        }
        for (Constrain constrain : constrains) {
            if (!constrain.isSatisfied(values)) {
                return false;
            }
        }
        return true;
    }

    /**
     * All points in lexicographic order for the given parameter values.
     *
     * @throws ToolkitFailure if a dimension is unbounded or there are more
     *                        than {@code limit} points
     */
    public List<long[]> enumerate(Map<String, Long> paramValues, long limit) {
        for (String param : params) {
            if (!paramValues.containsKey(param)) {
                throw new ToolkitFailure("no value for parameter " + param + " of " + name);
            }
        }
        List<Constrain> fixed = new ArrayList<>();
        for (Constrain constrain : constrains) {
            fixed.add(constrain.substitute(paramValues));
        }
        List<long[]> result = new ArrayList<>();
        int n = dims.size();
        if (n == 0) {
            for (Constrain constrain : fixed) {
                if (!constrain.holds()) {
                    return result;
                }
            }
            result.add(new long[0]);
            return result;
        }
        FourierMotzkin[] projection = new FourierMotzkin[n];
        projection[n - 1] = new FourierMotzkin(fixed);
        for (int k = n - 1; k > 0; --k) {
            projection[k - 1] = projection[k].copy().eliminate(dims.get(k));
        }
        if (projection[0].empty) {
            return result;
        }
        fill(0, new long[n], new HashMap<>(), projection, fixed, result, limit);
        return result;
    }

    private void fill(int k, long[] point, HashMap<String, Long> values, FourierMotzkin[] projection,
                      List<Constrain> fixed, List<long[]> result, long limit) {
        String dim = dims.get(k);
        Long lb = null;
        Long ub = null;
        for (Constrain constrain : projection[k].constrains) {
            Constrain known = constrain.substitute(values);
            if (!known.expr.contains(dim)) {
                if (!known.holds()) {
                    return;
                }
                continue;
            }
            Bound lower = Bound.of(known, dim, true);
            if (lower != null) {
                long value = lower.evaluate(values);
                lb = lb == null ? value : Math.max(lb, value);
            }
            Bound upper = Bound.of(known, dim, false);
            if (upper != null) {
                long value = upper.evaluate(values);
                ub = ub == null ? value : Math.min(ub, value);
            }
        }
        if (lb == null || ub == null) {
            throw new ToolkitFailure("dimension " + dim + " of " + name + " is unbounded");
        }
        for (long v = lb; v <= ub; ++v) {
            point[k] = v;
            values.put(dim, v);
            if (k == dims.size() - 1) {
                boolean inside = true;
                for (Constrain constrain : fixed) {
                    if (!constrain.isSatisfied(values)) {
                        inside = false;
                        break;
                    }
                }
                if (inside) {
                    if (result.size() >= limit) {
                        throw new ToolkitFailure(name + " has more than " + limit + " instances");
                    }
                    result.add(point.clone());
                }
            } else {
                fill(k + 1, point, values, projection, fixed, result, limit);
            }
        }
        values.remove(dim);
    }

    public List<String> order() {
        List<String> order = new ArrayList<>(dims);
        order.addAll(params);
        return order;
    }

    public String tupleString() {
        return name + "[" + String.join(", ", dims) + "]";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(tupleString());
        List<String> order = order();
        for (int i = 0; i < constrains.size(); ++i) {
            sb.append(i == 0 ? " : " : " and ").append(constrains.get(i).toString(order));
        }
        return sb.toString();
    }
}
