package polyopt.polyhedral.extract;

import polyopt.AST.expression.BinaryExp;
import polyopt.AST.expression.Expression;
import polyopt.AST.expression.NumberExp;
import polyopt.AST.expression.UnaryExp;
import polyopt.AST.expression.VariableLhsExp;
import polyopt.polyhedral.affine.Affine;

import java.util.function.Predicate;

public class AffineExpressions {
    /**
     * Affine form of {@code exp}, or null when it is not affine or names a
     * variable {@code allowed} rejects.
     */
    public static Affine toAffine(Expression exp, Predicate<String> allowed) {
        if (exp instanceof NumberExp number) {
            return Affine.constant(number.value);
        }
        if (exp instanceof VariableLhsExp variable) {
            if (!allowed.test(variable.variableName)) {
                return null;
            }
            return Affine.variable(variable.variableName);
        }
        if (exp instanceof UnaryExp unary) {
            Affine inner = toAffine(unary.exp, allowed);
            if (inner == null || unary.op.equals("!")) {
                return null;
            }
            return unary.op.equals("-") ? inner.mul(-1) : inner;
        }
        if (exp instanceof BinaryExp binary) {
            Affine lhs = toAffine(binary.lhs, allowed);
            Affine rhs = toAffine(binary.rhs, allowed);
            if (lhs == null || rhs == null) {
                return null;
            }
            switch (binary.op) {
                case "+" -> {
                    return lhs.merge(rhs, 1);
                }
                case "-" -> {
                    return lhs.merge(rhs, -1);
                }
                case "*" -> {
                    if (lhs.isConst()) {
                        return rhs.mul(lhs.bias);
                    }
                    if (rhs.isConst()) {
                        return lhs.mul(rhs.bias);
                    }
                    return null;
                }
                default -> {
                    return null;
                }
            }
        }
        return null;
    }
}
