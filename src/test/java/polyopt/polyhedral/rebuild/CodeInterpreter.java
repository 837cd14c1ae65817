package polyopt.polyhedral.rebuild;

import polyopt.polyhedral.affine.AffineFraction;
import polyopt.polyhedral.affine.Constrain;
import polyopt.polyhedral.matrix.Fraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs a generated loop nest and records the statement instances it executes,
 * e.g. {@code S_0[3]}, in execution order.
 */
public class CodeInterpreter {
    public final List<String> trace = new ArrayList<>();

    public static List<String> run(CodeNode node, Map<String, Long> params) {
        CodeInterpreter interpreter = new CodeInterpreter();
        interpreter.exec(node, new HashMap<>(params));
        return interpreter.trace;
    }

    private void exec(CodeNode node, HashMap<String, Long> env) {
        if (node instanceof BlockCode block) {
            for (CodeNode child : block.children) {
                exec(child, env);
            }
        } else if (node instanceof ForCode loop) {
            long lower = loop.lower.evaluate(env);
            long upper = loop.upper.evaluate(env);
            for (long value = lower; value <= upper; ++value) {
                env.put(loop.iterator, value);
                exec(loop.body, env);
            }
            env.remove(loop.iterator);
        } else if (node instanceof IfCode branch) {
            for (Constrain constrain : branch.conditions) {
                if (!constrain.isSatisfied(env)) {
                    return;
                }
            }
            exec(branch.body, env);
        } else if (node instanceof UserCode user) {
            long[] point = new long[user.stmt.iterators.size()];
            for (int i = 0; i < point.length; ++i) {
                AffineFraction value = user.values.get(user.stmt.iterators.get(i));
                Fraction result = value.evaluate(env);
                assertTrue(result.isInteger(), "fractional iterator value " + result + " for " + user.stmt.name);
                point[i] = result.toLong();
            }
            trace.add(key(user.stmt.name, point));
        }
    }

    public static String key(String name, long[] point) {
        StringBuilder sb = new StringBuilder(name).append('[');
        for (int i = 0; i < point.length; ++i) {
            sb.append(i == 0 ? "" : ", ").append(point[i]);
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return Arrays.toString(trace.toArray());
    }
}
