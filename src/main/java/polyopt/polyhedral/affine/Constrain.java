package polyopt.polyhedral.affine;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code expr = 0}, {@code expr >= 0} or {@code expr mod modulus = 0}.
 */
public class Constrain {
    public static final int EQ = 0;
    public static final int GE = 1;
    public static final int MOD = 2;

    public Affine expr;
    public int op;
    public long modulus;

    public Constrain(Affine expr_, int op_) {
        expr = expr_;
        op = op_;
        modulus = 0;
    }

    public Constrain(Affine expr_, long modulus_) {
        expr = expr_;
        op = MOD;
        modulus = modulus_;
    }

    public static Constrain ge(Affine lhs, Affine rhs) {
        return new Constrain(new Affine(lhs).merge(rhs, -1), GE);
    }

    public static Constrain eq(Affine lhs, Affine rhs) {
        return new Constrain(new Affine(lhs).merge(rhs, -1), EQ);
    }

    public boolean isConst() {
        return expr.isConst();
    }

    /**
     * Only meaningful for constant constraints.
     */
    public boolean holds() {
        return switch (op) {
            case EQ -> expr.bias == 0;
            case GE -> expr.bias >= 0;
            default -> Math.floorMod(expr.bias, modulus) == 0;
        };
    }

    public boolean isTrivial() {
        return isConst() && holds();
    }

    public boolean isInfeasible() {
        return isConst() && !holds();
    }

    public boolean isSatisfied(Map<String, Long> values) {
        long value = expr.evaluate(values);
        return switch (op) {
            case EQ -> value == 0;
            case GE -> value >= 0;
            default -> Math.floorMod(value, modulus) == 0;
        };
    }

    /**
     * Divides by the coefficient gcd, tightening the bias of an inequality to
     * the integer hull. An equality whose bias the gcd does not divide comes
     * back as the constant {@code 1 = 0}.
     */
    public Constrain normalize() {
        if (op == MOD) {
            Affine reduced = new Affine();
            for (var entry : expr.coefficient.entrySet()) {
                reduced.addVarCo(entry.getKey(), Math.floorMod(entry.getValue(), modulus));
            }
            reduced.addBias(Math.floorMod(expr.bias, modulus));
            return new Constrain(reduced, modulus);
        }
        long g = expr.coefficientGcd();
        if (g == 0) {
            return new Constrain(new Affine(expr), op);
        }
        Affine result = new Affine();
        for (var entry : expr.coefficient.entrySet()) {
            result.addVarCo(entry.getKey(), entry.getValue() / g);
        }
        if (op == GE) {
            result.addBias(Math.floorDiv(expr.bias, g));
            return new Constrain(result, GE);
        }
        if (expr.bias % g != 0) {
            return new Constrain(Affine.constant(1), EQ);
        }
        result.addBias(expr.bias / g);
        String first = new TreeMap<>(result.coefficient).firstKey();
        if (result.getCoe(first) < 0) {
            result.mul(-1);
        }
        return new Constrain(result, EQ);
    }

    public Constrain substitute(String variable, Affine value) {
        return op == MOD ? new Constrain(expr.substitute(variable, value), modulus) : new Constrain(expr.substitute(variable, value), op);
    }

    public Constrain substitute(Map<String, Long> values) {
        return op == MOD ? new Constrain(expr.substitute(values), modulus) : new Constrain(expr.substitute(values), op);
    }

    public Constrain rename(Map<String, String> names) {
        return op == MOD ? new Constrain(expr.rename(names), modulus) : new Constrain(expr.rename(names), op);
    }

    public String toString(List<String> order) {
        return switch (op) {
            case EQ -> expr.toString(order) + " = 0";
            case GE -> expr.toString(order) + " >= 0";
            default -> "(" + expr.toString(order) + ") mod " + modulus + " = 0";
        };
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Constrain other && op == other.op && modulus == other.modulus && expr.equals(other.expr);
    }

    @Override
    public int hashCode() {
        return (expr.hashCode() * 31 + op) * 31 + Long.hashCode(modulus);
    }

    @Override
    public String toString() {
        return toString(List.of());
    }
}
