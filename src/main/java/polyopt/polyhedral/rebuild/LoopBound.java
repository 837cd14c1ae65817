package polyopt.polyhedral.rebuild;

import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.Bound;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A loop bound: a single {@link Bound}, or the max/min of several.
 */
public class LoopBound {
    public static final int BOUND = 0;
    public static final int MAX = 1;
    public static final int MIN = 2;

    public final int kind;
    public final Bound bound;
    public final List<LoopBound> operands;

    private LoopBound(int kind_, Bound bound_, List<LoopBound> operands_) {
        kind = kind_;
        bound = bound_;
        operands = operands_;
    }

    public static LoopBound of(Bound bound) {
        return new LoopBound(BOUND, bound, List.of());
    }

    public static LoopBound max(List<LoopBound> operands) {
        return combine(MAX, operands);
    }

    public static LoopBound min(List<LoopBound> operands) {
        return combine(MIN, operands);
    }

    private static LoopBound combine(int kind, List<LoopBound> operands) {
        List<LoopBound> distinct = new ArrayList<>();
        for (LoopBound operand : operands) {
            if (!distinct.contains(operand)) {
                distinct.add(operand);
            }
        }
        if (distinct.size() == 1) {
            return distinct.get(0);
        }
        // fold the constant operands into one
        Long folded = null;
        List<LoopBound> rest = new ArrayList<>();
        for (LoopBound operand : distinct) {
            if (operand.isConst()) {
                long value = operand.evaluate(Map.of());
                folded = folded == null ? value : kind == MAX ? Math.max(folded, value) : Math.min(folded, value);
            } else {
                rest.add(operand);
            }
        }
        if (folded != null) {
            rest.add(of(new Bound(Affine.constant(folded), 1, kind == MAX)));
        }
        if (rest.size() == 1) {
            return rest.get(0);
        }
        return new LoopBound(kind, null, rest);
    }

    public boolean isConst() {
        if (kind == BOUND) {
            return bound.isConst();
        }
        return operands.stream().allMatch(LoopBound::isConst);
    }

    public long evaluate(Map<String, Long> values) {
        if (kind == BOUND) {
            return bound.evaluate(values);
        }
        long result = operands.get(0).evaluate(values);
        for (int i = 1; i < operands.size(); ++i) {
            long value = operands.get(i).evaluate(values);
            result = kind == MAX ? Math.max(result, value) : Math.min(result, value);
        }
        return result;
    }

    /**
     * C text; the helper macros it needs are added to {@code macros}.
     */
    public String print(Set<String> macros) {
        if (kind == BOUND) {
            if (bound.divisor == 1) {
                return bound.numerator.toString();
            }
            String macro = bound.lower ? "ceild" : "floord";
            macros.add(macro);
            return macro + "(" + bound.numerator + ", " + bound.divisor + ")";
        }
        String macro = kind == MAX ? "max" : "min";
        macros.add(macro);
        String text = operands.get(operands.size() - 1).print(macros);
        for (int i = operands.size() - 2; i >= 0; --i) {
            text = macro + "(" + operands.get(i).print(macros) + ", " + text + ")";
        }
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof LoopBound other) || kind != other.kind) {
            return false;
        }
        return kind == BOUND ? bound.equals(other.bound) : operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return kind == BOUND ? bound.hashCode() : operands.hashCode() * 3 + kind;
    }
}
