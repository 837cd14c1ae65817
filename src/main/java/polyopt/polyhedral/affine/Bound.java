package polyopt.polyhedral.affine;

import java.util.List;
import java.util.Map;

/**
 * One side of a variable's range: {@code x >= ceil(numerator / divisor)} for a
 * lower bound, {@code x <= floor(numerator / divisor)} for an upper one.
 */
public class Bound {
    public final Affine numerator;
    public final long divisor;
    public final boolean lower;

    public Bound(Affine numerator_, long divisor_, boolean lower_) {
        long g = Affine.gcd(numerator_.coefficientGcd(), Affine.gcd(numerator_.bias, divisor_));
        if (g > 1) {
            Affine reduced = new Affine();
            for (var entry : numerator_.coefficient.entrySet()) {
                reduced.addVarCo(entry.getKey(), entry.getValue() / g);
            }
            numerator_ = reduced.addBias(numerator_.bias / g);
            divisor_ /= g;
        }
        numerator = numerator_;
        divisor = divisor_;
        lower = lower_;
    }

    /**
     * Bound on {@code variable} implied by {@code constrain}, or null when the
     * constraint does not bound it from this side.
     */
    public static Bound of(Constrain constrain, String variable, boolean lower) {
        long coe = constrain.expr.getCoe(variable);
        if (coe == 0 || constrain.op == Constrain.MOD) {
            return null;
        }
        Affine rest = new Affine(constrain.expr);
        rest.coefficient.remove(variable);
        if (constrain.op == Constrain.GE && (coe > 0) != lower) {
            return null;
        }
        // coe * x + rest (>=|=) 0
        if (coe > 0) {
            return new Bound(rest.mul(-1), coe, lower);
        }
        return new Bound(rest, -coe, lower);
    }

    public boolean isConst() {
        return numerator.isConst();
    }

    public long evaluate(Map<String, Long> values) {
        long value = numerator.evaluate(values);
        return lower ? Math.floorDiv(value + divisor - 1, divisor) : Math.floorDiv(value, divisor);
    }

    /**
     * The inequality on {@code variable} this bound stands for.
     */
    public Constrain toConstrain(String variable) {
        Affine expr = new Affine(numerator);
        if (lower) {
            return new Constrain(expr.mul(-1).addVarCo(variable, divisor), Constrain.GE);
        }
        return new Constrain(expr.addVarCo(variable, -divisor), Constrain.GE);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Bound other && lower == other.lower && divisor == other.divisor && numerator.equals(other.numerator);
    }

    @Override
    public int hashCode() {
        return numerator.hashCode() * 31 + Long.hashCode(divisor) * 2 + (lower ? 1 : 0);
    }

    @Override
    public String toString() {
        String text = numerator.toString(List.of());
        if (divisor == 1) {
            return text;
        }
        return (lower ? "ceild(" : "floord(") + text + ", " + divisor + ")";
    }
}
