package polyopt.polyhedral.affine;

import polyopt.Util.error.ToolkitFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Affine part plus integer multiples of {@code floor(numerator / divisor)}.
 * Values are never mutated once built; {@link #linear()} hands out a copy.
 */
public class QuasiAffine {
    private final Affine linear;
    public final List<FloorTerm> floors;

    public static class FloorTerm {
        public final long coefficient;
        public final QuasiAffine numerator;
        public final long divisor;

        public FloorTerm(long coefficient_, QuasiAffine numerator_, long divisor_) {
            coefficient = coefficient_;
            numerator = numerator_;
            divisor = divisor_;
        }

        boolean sameFloor(FloorTerm other) {
            return divisor == other.divisor && numerator.equals(other.numerator);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof FloorTerm other && coefficient == other.coefficient && sameFloor(other);
        }

        @Override
        public int hashCode() {
            return (numerator.hashCode() * 31 + Long.hashCode(divisor)) * 31 + Long.hashCode(coefficient);
        }
    }

    public QuasiAffine(Affine linear_, List<FloorTerm> floors_) {
        linear = new Affine(linear_);
        List<FloorTerm> merged = new ArrayList<>();
        for (FloorTerm term : floors_) {
            boolean found = false;
            for (int i = 0; i < merged.size(); ++i) {
                if (merged.get(i).sameFloor(term)) {
                    var old = merged.get(i);
                    merged.set(i, new FloorTerm(old.coefficient + term.coefficient, old.numerator, old.divisor));
                    found = true;
                    break;
                }
            }
            if (!found) {
                merged.add(term);
            }
        }
        merged.removeIf(term -> term.coefficient == 0);
        floors = Collections.unmodifiableList(merged);
    }

    public static QuasiAffine of(Affine affine) {
        return new QuasiAffine(affine, List.of());
    }

    public static QuasiAffine constant(long value) {
        return of(Affine.constant(value));
    }

    public static QuasiAffine variable(String name) {
        return of(Affine.variable(name));
    }

    public Affine linear() {
        return new Affine(linear);
    }

    public long bias() {
        return linear.bias;
    }

    public boolean isAffine() {
        return floors.isEmpty();
    }

    public boolean isConst() {
        return floors.isEmpty() && linear.isConst();
    }

    public boolean isZero() {
        return floors.isEmpty() && linear.isZero();
    }

    public QuasiAffine add(QuasiAffine other) {
        List<FloorTerm> terms = new ArrayList<>(floors);
        terms.addAll(other.floors);
        return new QuasiAffine(new Affine(linear).merge(other.linear, 1), terms);
    }

    public QuasiAffine add(Affine other) {
        return new QuasiAffine(new Affine(linear).merge(other, 1), floors);
    }

    public QuasiAffine mul(long k) {
        List<FloorTerm> terms = new ArrayList<>();
        for (FloorTerm term : floors) {
            terms.add(new FloorTerm(Math.multiplyExact(term.coefficient, k), term.numerator, term.divisor));
        }
        return new QuasiAffine(new Affine(linear).mul(k), terms);
    }

    public QuasiAffine floorDiv(long divisor) {
        if (divisor <= 0) {
            throw new ToolkitFailure("floor division by non-positive " + divisor);
        }
        if (divisor == 1) {
            return this;
        }
        if (isAffine() && linear.bias % divisor == 0 && linear.coefficientGcd() % divisor == 0) {
            Affine result = new Affine();
            for (var entry : linear.coefficient.entrySet()) {
                result.addVarCo(entry.getKey(), entry.getValue() / divisor);
            }
            return of(result.addBias(linear.bias / divisor));
        }
        if (linear.isZero() && floors.size() == 1 && floors.get(0).coefficient == 1) {
            // floor(floor(e / a) / b) == floor(e / (a * b))
            var inner = floors.get(0);
            return new QuasiAffine(new Affine(), List.of(new FloorTerm(1, inner.numerator, Math.multiplyExact(inner.divisor, divisor))));
        }
        return new QuasiAffine(new Affine(), List.of(new FloorTerm(1, this, divisor)));
    }

    public long evaluate(Map<String, Long> values) {
        long result = linear.evaluate(values);
        for (FloorTerm term : floors) {
            long inner = Math.floorDiv(term.numerator.evaluate(values), term.divisor);
            result = Math.addExact(result, Math.multiplyExact(term.coefficient, inner));
        }
        return result;
    }

    public QuasiAffine rename(Map<String, String> names) {
        List<FloorTerm> terms = new ArrayList<>();
        for (FloorTerm term : floors) {
            terms.add(new FloorTerm(term.coefficient, term.numerator.rename(names), term.divisor));
        }
        return new QuasiAffine(linear.rename(names), terms);
    }

    public Set<String> variables() {
        Set<String> result = new LinkedHashSet<>(linear.coefficient.keySet());
        for (FloorTerm term : floors) {
            result.addAll(term.numerator.variables());
        }
        return result;
    }

    /**
     * Affine form in which every floor is replaced by a fresh variable
     * {@code a} bounded by {@code 0 <= numerator - divisor * a <= divisor - 1}.
     * The bounding constraints are appended to {@code definitions}.
     */
    public Affine linearize(Supplier<String> freshName, List<Constrain> definitions) {
        Affine result = new Affine(linear);
        for (FloorTerm term : floors) {
            Affine numerator = term.numerator.linearize(freshName, definitions);
            String aux = freshName.get();
            Affine low = new Affine(numerator).addVarCo(aux, -term.divisor);
            Affine high = new Affine(numerator).mul(-1).addVarCo(aux, term.divisor).addBias(term.divisor - 1);
            definitions.add(new Constrain(low, Constrain.GE));
            definitions.add(new Constrain(high, Constrain.GE));
            result.addVarCo(aux, term.coefficient);
        }
        return result;
    }

    public String toString(List<String> order) {
        StringBuilder sb = new StringBuilder();
        List<String> names = new ArrayList<>();
        for (String name : order) {
            if (linear.contains(name)) {
                names.add(name);
            }
        }
        for (String name : new TreeSet<>(linear.coefficient.keySet())) {
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        for (String name : names) {
            Affine.appendTerm(sb, linear.coefficient.get(name), name);
        }
        for (FloorTerm term : floors) {
            Affine.appendTerm(sb, term.coefficient, "floor((" + term.numerator.toString(order) + ")/" + term.divisor + ")");
        }
        if (linear.bias != 0 || sb.length() == 0) {
            Affine.appendTerm(sb, linear.bias, null);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof QuasiAffine other && linear.equals(other.linear)
                && floors.size() == other.floors.size() && new LinkedHashSet<>(floors).equals(new LinkedHashSet<>(other.floors));
    }

    @Override
    public int hashCode() {
        return linear.hashCode() * 31 + new LinkedHashSet<>(floors).hashCode();
    }

    @Override
    public String toString() {
        return toString(List.of());
    }
}
