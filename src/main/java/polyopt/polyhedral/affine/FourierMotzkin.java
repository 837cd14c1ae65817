package polyopt.polyhedral.affine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;

/**
 * Rational projection of a conjunction of equalities and inequalities, with
 * integer tightening of every derived constraint. Modulo constraints are
 * ignored, so the projection over-approximates the integer points.
 */
public class FourierMotzkin {
    public List<Constrain> constrains;
    public boolean empty;

    public FourierMotzkin(Collection<Constrain> constrains_) {
        constrains = new ArrayList<>();
        empty = false;
        for (Constrain constrain : constrains_) {
            if (constrain.op != Constrain.MOD) {
                add(constrain);
            }
        }
        simplify();
    }

    public FourierMotzkin copy() {
        FourierMotzkin result = new FourierMotzkin(List.of());
        result.constrains.addAll(constrains);
        result.empty = empty;
        return result;
    }

    private void add(Constrain constrain) {
        Constrain normalized = constrain.normalize();
        if (normalized.isInfeasible()) {
            empty = true;
        } else if (!normalized.isTrivial() && !constrains.contains(normalized)) {
            constrains.add(normalized);
        }
    }

    // keeps only the tightest of parallel inequalities
    private void simplify() {
        HashMap<HashMap<String, Long>, Constrain> tightest = new HashMap<>();
        List<Constrain> result = new ArrayList<>();
        for (Constrain constrain : constrains) {
            if (constrain.op != Constrain.GE) {
                result.add(constrain);
                continue;
            }
            var old = tightest.get(constrain.expr.coefficient);
            if (old == null || constrain.expr.bias < old.expr.bias) {
                tightest.put(constrain.expr.coefficient, constrain);
            }
        }
        for (Constrain constrain : constrains) {
            if (constrain.op == Constrain.GE && tightest.get(constrain.expr.coefficient) == constrain) {
                result.add(constrain);
            }
        }
        // x + c >= 0 and -x - c' >= 0 with c < c' is empty
        for (Constrain constrain : result) {
            if (constrain.op != Constrain.GE) {
                continue;
            }
            HashMap<String, Long> negated = new HashMap<>();
            constrain.expr.coefficient.forEach((k, v) -> negated.put(k, -v));
            var opposite = tightest.get(negated);
            if (opposite != null && constrain.expr.bias + opposite.expr.bias < 0) {
                empty = true;
            }
        }
        constrains = result;
    }

    public FourierMotzkin eliminate(String variable) {
        if (empty) {
            return this;
        }
        List<Constrain> with = new ArrayList<>();
        List<Constrain> without = new ArrayList<>();
        for (Constrain constrain : constrains) {
            (constrain.expr.contains(variable) ? with : without).add(constrain);
        }
        if (with.isEmpty()) {
            return this;
        }
        Constrain pivot = null;
        for (Constrain constrain : with) {
            if (constrain.op == Constrain.EQ && (pivot == null || Math.abs(constrain.expr.getCoe(variable)) == 1)) {
                pivot = constrain;
            }
        }
        constrains = new ArrayList<>();
        for (Constrain constrain : without) {
            add(constrain);
        }
        if (pivot != null) {
            long a = pivot.expr.getCoe(variable);
            if (Math.abs(a) == 1) {
                Affine value = new Affine(pivot.expr);
                value.coefficient.remove(variable);
                value.mul(-a);
                for (Constrain constrain : with) {
                    if (constrain != pivot) {
                        add(constrain.substitute(variable, value));
                    }
                }
            } else {
                Affine e = new Affine(pivot.expr);
                if (a < 0) {
                    e.mul(-1);
                    a = -a;
                }
                for (Constrain constrain : with) {
                    if (constrain == pivot) {
                        continue;
                    }
                    long b = constrain.expr.getCoe(variable);
                    Affine combined = new Affine(constrain.expr).mul(a).merge(e, -b);
                    add(new Constrain(combined, constrain.op));
                }
            }
        } else {
            List<Constrain> lowers = new ArrayList<>();
            List<Constrain> uppers = new ArrayList<>();
            for (Constrain constrain : with) {
                (constrain.expr.getCoe(variable) > 0 ? lowers : uppers).add(constrain);
            }
            for (Constrain lower : lowers) {
                long a = lower.expr.getCoe(variable);
                for (Constrain upper : uppers) {
                    long b = -upper.expr.getCoe(variable);
                    Affine combined = new Affine(lower.expr).mul(b).merge(upper.expr, a);
                    add(new Constrain(combined, Constrain.GE));
                }
            }
        }
        simplify();
        return this;
    }

    public FourierMotzkin eliminateAll(Collection<String> variables) {
        for (String variable : variables) {
            eliminate(variable);
        }
        return this;
    }

    public List<Bound> lowerBounds(String variable) {
        return bounds(variable, true);
    }

    public List<Bound> upperBounds(String variable) {
        return bounds(variable, false);
    }

    private List<Bound> bounds(String variable, boolean lower) {
        List<Bound> result = new ArrayList<>();
        for (Constrain constrain : constrains) {
            Bound bound = Bound.of(constrain, variable, lower);
            if (bound != null && !result.contains(bound)) {
                result.add(bound);
            }
        }
        return result;
    }
}
