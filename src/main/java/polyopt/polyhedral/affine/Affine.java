package polyopt.polyhedral.affine;

import polyopt.Util.error.ToolkitFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code sum(coefficient[v] * v) + bias} over named integer variables.
 * Zero coefficients are never stored.
 */
public class Affine {
    public HashMap<String, Long> coefficient;
    public long bias;

    public Affine() {
        coefficient = new HashMap<>();
        bias = 0;
    }

    public Affine(Affine obj) {
        coefficient = new HashMap<>();
        coefficient.putAll(obj.coefficient);
        bias = obj.bias;
    }

    public static Affine constant(long value) {
        return new Affine().addBias(value);
    }

    public static Affine variable(String name) {
        return new Affine().addVarCo(name, 1);
    }

    public Affine addVarCo(String variable, long coefficient_) {
        coefficient.merge(variable, coefficient_, Math::addExact);
        if (coefficient.get(variable) == 0) {
            coefficient.remove(variable);
        }
        return this;
    }

    public Affine addBias(long bias_) {
        bias = Math.addExact(bias, bias_);
        return this;
    }

    public Affine merge(Affine obj, long mul) {
        for (var entry : obj.coefficient.entrySet()) {
            coefficient.merge(entry.getKey(), Math.multiplyExact(entry.getValue(), mul), Math::addExact);
        }
        coefficient.entrySet().removeIf(entry -> entry.getValue() == 0);
        bias = Math.addExact(bias, Math.multiplyExact(obj.bias, mul));
        return this;
    }

    public Affine mul(long mul) {
        if (mul == 0) {
            coefficient.clear();
            bias = 0;
            return this;
        }
        for (var entry : coefficient.entrySet()) {
            entry.setValue(Math.multiplyExact(entry.getValue(), mul));
        }
        bias = Math.multiplyExact(bias, mul);
        return this;
    }

    public boolean isConst() {
        return coefficient.isEmpty();
    }

    public boolean isZero() {
        return coefficient.isEmpty() && bias == 0;
    }

    public long getCoe(String variable) {
        return coefficient.getOrDefault(variable, 0L);
    }

    public boolean contains(String variable) {
        return coefficient.containsKey(variable);
    }

    /**
     * gcd of the variable coefficients, 0 for a constant.
     */
    public long coefficientGcd() {
        long g = 0;
        for (long c : coefficient.values()) {
            g = gcd(g, c);
        }
        return g;
    }

    /**
     * Replaces {@code variable} by {@code value}; returns a new affine.
     */
    public Affine substitute(String variable, Affine value) {
        Affine result = new Affine(this);
        long coe = result.getCoe(variable);
        if (coe == 0) {
            return result;
        }
        result.coefficient.remove(variable);
        return result.merge(value, coe);
    }

    /**
     * Folds the variables that have a value into the bias; returns a new affine.
     */
    public Affine substitute(Map<String, Long> values) {
        Affine result = new Affine();
        result.bias = bias;
        for (var entry : coefficient.entrySet()) {
            Long value = values.get(entry.getKey());
            if (value == null) {
                result.addVarCo(entry.getKey(), entry.getValue());
            } else {
                result.addBias(Math.multiplyExact(entry.getValue(), value));
            }
        }
        return result;
    }

    public Affine rename(Map<String, String> names) {
        Affine result = new Affine();
        result.bias = bias;
        for (var entry : coefficient.entrySet()) {
            result.addVarCo(names.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        }
        return result;
    }

    public long evaluate(Map<String, Long> values) {
        long result = bias;
        for (var entry : coefficient.entrySet()) {
            Long value = values.get(entry.getKey());
            if (value == null) {
                throw new ToolkitFailure("no value for variable " + entry.getKey());
            }
            result = Math.addExact(result, Math.multiplyExact(entry.getValue(), value));
        }
        return result;
    }

    /**
     * Prints the terms in {@code order}; variables not listed follow in
     * lexicographic order.
     */
    public String toString(List<String> order) {
        List<String> names = new ArrayList<>();
        for (String name : order) {
            if (coefficient.containsKey(name)) {
                names.add(name);
            }
        }
        for (String name : new TreeMap<>(coefficient).keySet()) {
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            appendTerm(sb, coefficient.get(name), name);
        }
        if (bias != 0 || sb.length() == 0) {
            appendTerm(sb, bias, null);
        }
        return sb.toString();
    }

    static void appendTerm(StringBuilder sb, long coe, String name) {
        if (sb.length() != 0) {
            sb.append(coe < 0 ? " - " : " + ");
            coe = Math.abs(coe);
        } else if (coe < 0 && name != null) {
            sb.append("-");
            coe = -coe;
        }
        if (name == null) {
            sb.append(coe);
        } else if (coe == 1) {
            sb.append(name);
        } else {
            sb.append(coe).append(" * ").append(name);
        }
    }

    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long tmp = b;
            b = a % b;
            a = tmp;
        }
        return a;
    }

    public static Collection<String> variables(Collection<Affine> affines) {
        List<String> result = new ArrayList<>();
        for (Affine affine : affines) {
            for (String name : affine.coefficient.keySet()) {
                if (!result.contains(name)) {
                    result.add(name);
                }
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Affine other)) {
            return false;
        }
        return bias == other.bias && coefficient.equals(other.coefficient);
    }

    @Override
    public int hashCode() {
        return coefficient.hashCode() * 31 + Long.hashCode(bias);
    }

    @Override
    public String toString() {
        return toString(List.of());
    }
}
