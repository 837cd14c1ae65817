package polyopt.polyhedral.rebuild;

import polyopt.AST.ASTVisitor;
import polyopt.AST.Program;
import polyopt.AST.expression.ArrayElementLhsExp;
import polyopt.AST.expression.AssignExp;
import polyopt.AST.expression.BinaryExp;
import polyopt.AST.expression.Expression;
import polyopt.AST.expression.FloatExp;
import polyopt.AST.expression.FunctionCallLhsExp;
import polyopt.AST.expression.NumberExp;
import polyopt.AST.expression.PostfixExp;
import polyopt.AST.expression.PrefixLhsExp;
import polyopt.AST.expression.TernaryExp;
import polyopt.AST.expression.UnaryExp;
import polyopt.AST.expression.VariableLhsExp;
import polyopt.AST.statement.Statement;
import polyopt.AST.statement.Suite;
import polyopt.AST.statement.loopStatement.ForLoop;
import polyopt.AST.statement.selectStatement.SelectStatement;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.AffineFraction;
import polyopt.polyhedral.extract.AffineExpressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prints a statement body with its iterators replaced by their values in
 * the generated loops. Parentheses are emitted only where C precedence
 * needs them.
 */
public class StatementPrinter implements ASTVisitor {
    // C precedence, higher binds tighter
    private static final int ASSIGN = 0;
    private static final int TERNARY = 1;
    private static final int UNARY = 12;
    private static final int POSTFIX = 13;
    private static final int ATOM = 14;

    private final Map<String, AffineFraction> values;
    private String text;
    private int precedence;

    public StatementPrinter(Map<String, AffineFraction> values_) {
        values = values_;
    }

    public String print(Expression exp) {
        exp.accept(this);
        return text;
    }

    private String operand(Expression exp, int min) {
        exp.accept(this);
        return precedence < min ? "(" + text + ")" : text;
    }

    private void result(String text_, int precedence_) {
        text = text_;
        precedence = precedence_;
    }

    private static int binaryPrecedence(String op) {
        return switch (op) {
            case "*", "/", "%" -> 11;
            case "+", "-" -> 10;
            case "<<", ">>" -> 9;
            case "<", "<=", ">", ">=" -> 8;
            case "==", "!=" -> 7;
            case "&" -> 6;
            case "^" -> 5;
            case "|" -> 4;
            case "&&" -> 3;
            case "||" -> 2;
            default -> throw new ToolkitFailure("unknown operator " + op);
        };
    }

    private void value(AffineFraction value) {
        long de = value.denominator();
        Affine numerator = value.numerator();
        int terms = numerator.coefficient.size() + (numerator.bias != 0 ? 1 : 0);
        String numText = numerator.toString();
        int numPrecedence;
        if (terms <= 1 && numerator.coefficient.isEmpty()) {
            numPrecedence = numerator.bias < 0 ? UNARY : ATOM;
        } else if (terms == 1) {
            long coe = numerator.coefficient.values().iterator().next();
            numPrecedence = coe == 1 ? ATOM : coe == -1 ? UNARY : 11;
        } else {
            numPrecedence = 10;
        }
        if (de == 1) {
            result(numText, numPrecedence);
        } else {
            result((numPrecedence < 11 ? "(" + numText + ")" : numText) + " / " + de, 11);
        }
    }

    @Override
    public void visit(NumberExp node) {
        result(node.text, ATOM);
    }

    @Override
    public void visit(FloatExp node) {
        result(node.text, ATOM);
    }

    @Override
    public void visit(VariableLhsExp node) {
        AffineFraction value = values.get(node.variableName);
        if (value == null) {
            result(node.variableName, ATOM);
        } else {
            value(value);
        }
    }

    @Override
    public void visit(ArrayElementLhsExp node) {
        String array = operand(node.variable, POSTFIX);
        Affine index = AffineExpressions.toAffine(node.index, name -> true);
        String indexText;
        if (index != null && index.coefficient.keySet().stream().anyMatch(values::containsKey)) {
            value(AffineFraction.compose(index, values));
            indexText = text;
        } else {
            indexText = print(node.index);
        }
        result(array + "[" + indexText + "]", POSTFIX);
    }

    @Override
    public void visit(FunctionCallLhsExp node) {
        List<String> args = new ArrayList<>();
        for (Expression exp : node.callExpList) {
            args.add(operand(exp, TERNARY));
        }
        result(node.functionName + "(" + String.join(", ", args) + ")", POSTFIX);
    }

    @Override
    public void visit(BinaryExp node) {
        int own = binaryPrecedence(node.op);
        String lhs = operand(node.lhs, own);
        String rhs = operand(node.rhs, own + 1);
        result(lhs + " " + node.op + " " + rhs, own);
    }

    @Override
    public void visit(UnaryExp node) {
        result(node.op + unaryOperand(node.op, node.exp), UNARY);
    }

    @Override
    public void visit(PrefixLhsExp node) {
        result(node.op + unaryOperand(node.op, node.exp), UNARY);
    }

    // keeps "- -x" from printing as "--x"
    private String unaryOperand(String op, Expression exp) {
        String inner = operand(exp, UNARY);
        char last = op.charAt(op.length() - 1);
        if ((last == '-' || last == '+') && inner.charAt(0) == last) {
            return "(" + inner + ")";
        }
        return inner;
    }

    @Override
    public void visit(PostfixExp node) {
        result(operand(node.exp, POSTFIX) + node.op, POSTFIX);
    }

    @Override
    public void visit(TernaryExp node) {
        String condition = operand(node.condition, TERNARY + 1);
        String trueText = operand(node.trueExp, ASSIGN);
        String falseText = operand(node.falseExp, TERNARY);
        result(condition + " ? " + trueText + " : " + falseText, TERNARY);
    }

    @Override
    public void visit(AssignExp node) {
        String lhs = operand(node.lhs, UNARY);
        String rhs = operand(node.rhs, ASSIGN);
        result(lhs + " " + node.op + " " + rhs, ASSIGN);
    }

    @Override
    public void visit(Program node) {
        throw new ToolkitFailure("only expressions are printed");
    }

    @Override
    public void visit(Statement node) {
        throw new ToolkitFailure("only expressions are printed");
    }

    @Override
    public void visit(Suite node) {
        throw new ToolkitFailure("only expressions are printed");
    }

    @Override
    public void visit(ForLoop node) {
        throw new ToolkitFailure("only expressions are printed");
    }

    @Override
    public void visit(SelectStatement node) {
        throw new ToolkitFailure("only expressions are printed");
    }
}
