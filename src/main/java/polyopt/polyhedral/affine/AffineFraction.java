package polyopt.polyhedral.affine;

import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.matrix.Fraction;

import java.util.HashMap;
import java.util.Map;

import static java.lang.Math.abs;
import static polyopt.polyhedral.matrix.Fraction.getDenominatorLCM;

/**
 * Affine expression with rational coefficients, the value of an iterator
 * recovered from a schedule.
 */
public class AffineFraction {
    public HashMap<String, Fraction> coefficient;
    public Fraction bias;

    public AffineFraction() {
        coefficient = new HashMap<>();
        bias = new Fraction(0);
    }

    public AffineFraction(AffineFraction obj) {
        coefficient = new HashMap<>(obj.coefficient);
        bias = obj.bias;
    }

    public AffineFraction(Affine obj) {
        coefficient = new HashMap<>();
        for (var entry : obj.coefficient.entrySet()) {
            coefficient.put(entry.getKey(), new Fraction(entry.getValue()));
        }
        bias = new Fraction(obj.bias);
    }

    public AffineFraction addVarCo(String variable, Fraction coefficient_) {
        coefficient.merge(variable, coefficient_, Fraction::add);
        if (coefficient.get(variable).equal(0)) {
            coefficient.remove(variable);
        }
        return this;
    }

    public AffineFraction addBias(Fraction bias_) {
        bias = bias.add(bias_);
        return this;
    }

    public boolean isConst() {
        return coefficient.isEmpty();
    }

    public Fraction getCoe(String variable) {
        return coefficient.getOrDefault(variable, new Fraction(0));
    }

    public AffineFraction merge(AffineFraction obj, Fraction mul) {
        for (var entry : obj.coefficient.entrySet()) {
            addVarCo(entry.getKey(), entry.getValue().mul(mul));
        }
        bias = bias.add(obj.bias.mul(mul));
        return this;
    }

    public AffineFraction mul(Fraction mul) {
        coefficient.replaceAll((k, v) -> v.mul(mul));
        coefficient.values().removeIf(v -> v.equal(0));
        bias = bias.mul(mul);
        return this;
    }

    public AffineFraction div(Fraction div) {
        coefficient.replaceAll((k, v) -> v.div(div));
        bias = bias.div(div);
        return this;
    }

    /**
     * {@code affine} with each variable that has a value replaced by it.
     */
    public static AffineFraction compose(Affine affine, Map<String, AffineFraction> values) {
        AffineFraction result = new AffineFraction();
        result.bias = new Fraction(affine.bias);
        for (var entry : affine.coefficient.entrySet()) {
            var value = values.get(entry.getKey());
            if (value == null) {
                result.addVarCo(entry.getKey(), new Fraction(entry.getValue()));
            } else {
                result.merge(value, new Fraction(entry.getValue()));
            }
        }
        return result;
    }

    public long denominator() {
        long de = bias.denominator();
        for (var value : coefficient.values()) {
            de = getDenominatorLCM(de, value.denominator());
        }
        return abs(de);
    }

    /**
     * {@code denominator() * this}, which has integer coefficients.
     */
    public Affine numerator() {
        long de = denominator();
        Affine result = new Affine();
        for (var entry : coefficient.entrySet()) {
            result.addVarCo(entry.getKey(), entry.getValue().mul(de).toLong());
        }
        return result.addBias(bias.mul(de).toLong());
    }

    public Fraction evaluate(Map<String, Long> values) {
        Fraction result = bias;
        for (var entry : coefficient.entrySet()) {
            Long value = values.get(entry.getKey());
            if (value == null) {
                throw new ToolkitFailure("no value for variable " + entry.getKey());
            }
            result = result.add(entry.getValue().mul(value));
        }
        return result;
    }

    @Override
    public String toString() {
        long de = denominator();
        String text = numerator().toString();
        return de == 1 ? text : "(" + text + ")/" + de;
    }

    public boolean isIntegral() {
        return denominator() == 1;
    }
}
