package polyopt.polyhedral.rebuild;

import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.Constrain;
import polyopt.polyhedral.schedule.LoopType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints a generated loop nest as C. The helper macros the bounds use are
 * defined ahead of the code.
 */
public class CodePrinter {
    private final String baseIndent;
    private final String step;
    private final Set<String> macros = new LinkedHashSet<>();
    private final StringBuilder sb = new StringBuilder();

    public CodePrinter(String baseIndent_, int indent) {
        baseIndent = baseIndent_;
        step = " ".repeat(indent);
    }

    public String print(CodeNode node) {
        sb.setLength(0);
        macros.clear();
        print(node, baseIndent);
        StringBuilder result = new StringBuilder();
        for (String macro : List.of("floord", "ceild", "max", "min")) {
            if (macros.contains(macro)) {
                result.append(define(macro)).append('\n');
            }
        }
        return result.append(sb).toString();
    }

    private static String define(String macro) {
        return switch (macro) {
            case "floord" -> "#define floord(n,d) (((n)<0) ? -((-(n)+(d)-1)/(d)) : (n)/(d))";
            case "ceild" -> "#define ceild(n,d) (((n)<0) ? -((-(n))/(d)) : ((n)+(d)-1)/(d))";
            case "max" -> "#define max(x,y) ((x) > (y) ? (x) : (y))";
            default -> "#define min(x,y) ((x) < (y) ? (x) : (y))";
        };
    }

    private void line(String indent, String text) {
        sb.append(indent).append(text).append('\n');
    }

    private void print(CodeNode node, String indent) {
        if (node instanceof BlockCode block) {
            for (CodeNode child : block.children) {
                print(child, indent);
            }
        } else if (node instanceof ForCode loop) {
            if (loop.type == LoopType.PARALLEL) {
                line(indent, "#pragma omp parallel for");
            } else if (loop.type == LoopType.UNROLL) {
                line(indent, "#pragma unroll");
            }
            String lower = loop.lower.print(macros);
            String upper = loop.upper.print(macros);
            String it = loop.iterator;
            line(indent, "for (int " + it + " = " + lower + "; " + it + " <= " + upper + "; " + it + "++)");
            body(loop.body, indent);
        } else if (node instanceof IfCode branch) {
            List<String> conditions = new ArrayList<>();
            for (Constrain constrain : branch.conditions) {
                conditions.add(condition(constrain));
            }
            line(indent, "if (" + String.join(" && ", conditions) + ")");
            body(branch.body, indent);
        } else if (node instanceof UserCode user) {
            line(indent, new StatementPrinter(user.values).print(user.stmt.exp) + ";");
        }
    }

    private void body(CodeNode node, String indent) {
        if (node instanceof BlockCode) {
            line(indent, "{");
            print(node, indent + step);
            line(indent, "}");
        } else {
            print(node, indent + step);
        }
    }

    /**
     * {@code 2 * c0 - N >= 0} is printed as {@code 2 * c0 >= N}.
     */
    static String condition(Constrain constrain) {
        if (constrain.op == Constrain.MOD) {
            return "(" + constrain.expr + ") % " + constrain.modulus + " == 0";
        }
        Affine lhs = new Affine();
        Affine rhs = new Affine();
        for (var entry : constrain.expr.coefficient.entrySet()) {
            if (entry.getValue() > 0) {
                lhs.addVarCo(entry.getKey(), entry.getValue());
            } else {
                rhs.addVarCo(entry.getKey(), -entry.getValue());
            }
        }
        if (lhs.coefficient.isEmpty()) {
            // only negative terms: -x + b >= 0 reads b >= x
            Affine swap = lhs;
            lhs = rhs;
            rhs = swap;
            rhs.addBias(constrain.expr.bias);
            return lhs + (constrain.op == Constrain.EQ ? " == " : " <= ") + rhs;
        }
        rhs.addBias(-constrain.expr.bias);
        return lhs + (constrain.op == Constrain.EQ ? " == " : " >= ") + rhs;
    }
}
