package polyopt.polyhedral.rebuild;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.AffineFraction;
import polyopt.polyhedral.affine.Bound;
import polyopt.polyhedral.affine.Constrain;
import polyopt.polyhedral.affine.FourierMotzkin;
import polyopt.polyhedral.affine.UnionPwAff;
import polyopt.polyhedral.extract.Assign;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.matrix.Fraction;
import polyopt.polyhedral.matrix.Matrix;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.DomainNode;
import polyopt.polyhedral.schedule.FilterNode;
import polyopt.polyhedral.schedule.LeafNode;
import polyopt.polyhedral.schedule.LoopType;
import polyopt.polyhedral.schedule.ScheduleNode;
import polyopt.polyhedral.schedule.SequenceNode;
import polyopt.polyhedral.schedule.SetNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scans a schedule tree into a loop nest. Every band dimension becomes a
 * loop {@code c<depth>} whose bounds are the Fourier-Motzkin projection of
 * the statements reaching it; at a leaf the statement iterators are solved
 * from the loop iterators, and whatever the loops do not already enforce
 * is left in a guard.
 */
public class CodeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

    private final Domain domain;
    private final String prefix;

    // constraints of one statement, over its iterators, the loop iterators
    // introduced so far and the auxiliary floor variables
    private static class Context {
        final Assign stmt;
        final List<Constrain> constrains;
        final List<String> aux;

        Context(Assign stmt_, List<Constrain> constrains_) {
            stmt = stmt_;
            constrains = new ArrayList<>(constrains_);
            aux = new ArrayList<>();
        }

        Context(Context obj) {
            stmt = obj.stmt;
            constrains = new ArrayList<>(obj.constrains);
            aux = new ArrayList<>(obj.aux);
        }

        String freshAux() {
            String name = stmt.name + "#" + aux.size();
            aux.add(name);
            return name;
        }

        List<String> unknowns() {
            List<String> result = new ArrayList<>(stmt.iterators);
            result.addAll(aux);
            return result;
        }
    }

    public CodeGenerator(Domain domain_, String prefix_) {
        domain = domain_;
        prefix = prefix_;
    }

    public CodeNode generate(DomainNode root) {
        LinkedHashMap<String, Context> contexts = new LinkedHashMap<>();
        for (String name : root.domain.names()) {
            contexts.put(name, new Context(domain.getAssign(name), root.domain.get(name).constrains));
        }
        CodeNode result = visit(root.child, contexts, 0, new HashSet<>());
        return result == null ? new BlockCode(List.of()) : result;
    }

    private CodeNode visit(ScheduleNode node, LinkedHashMap<String, Context> contexts, int depth, Set<Constrain> guaranteed) {
        if (contexts.isEmpty()) {
            return null;
        }
        if (node instanceof BandNode band) {
            return visitBand(band, contexts, depth, guaranteed);
        }
        if (node instanceof FilterNode filter) {
            LinkedHashMap<String, Context> kept = new LinkedHashMap<>();
            contexts.forEach((name, context) -> {
                if (filter.statements.contains(name)) {
                    kept.put(name, context);
                }
            });
            return visit(filter.child, kept, depth, guaranteed);
        }
        if (node instanceof SequenceNode || node instanceof SetNode) {
            List<CodeNode> children = new ArrayList<>();
            for (ScheduleNode child : node.children()) {
                add(children, visit(child, contexts, depth, guaranteed));
            }
            return block(children);
        }
        if (node instanceof LeafNode) {
            List<CodeNode> children = new ArrayList<>();
            for (Context context : contexts.values()) {
                add(children, visitUser(context, depth, guaranteed));
            }
            return block(children);
        }
        throw new ToolkitFailure("unexpected " + node.kind() + " node under the domain");
    }

    private static void add(List<CodeNode> children, CodeNode code) {
        if (code instanceof BlockCode block) {
            children.addAll(block.children);
        } else if (code != null) {
            children.add(code);
        }
    }

    private static CodeNode block(List<CodeNode> children) {
        if (children.isEmpty()) {
            return null;
        }
        return children.size() == 1 ? children.get(0) : new BlockCode(children);
    }

    private CodeNode visitBand(BandNode band, LinkedHashMap<String, Context> contexts, int depth, Set<Constrain> guaranteed) {
        LinkedHashMap<String, Context> current = new LinkedHashMap<>();
        contexts.forEach((name, context) -> current.put(name, new Context(context)));
        Set<Constrain> known = new HashSet<>(guaranteed);
        List<String> iterators = new ArrayList<>();
        List<LoopBound> lowers = new ArrayList<>();
        List<LoopBound> uppers = new ArrayList<>();
        for (int k = 0; k < band.dims(); ++k) {
            String iterator = prefix + (depth + k);
            UnionPwAff dim = band.schedule.get(k);
            for (var entry : current.entrySet()) {
                var piece = dim.get(entry.getKey());
                if (piece == null) {
                    throw new ToolkitFailure("band has no schedule for " + entry.getKey());
                }
                Context context = entry.getValue();
                Affine value = piece.expr.linearize(context::freshAux, context.constrains);
                context.constrains.add(new Constrain(Affine.variable(iterator).merge(value, -1), Constrain.EQ));
            }
            List<Set<Bound>> lowerSets = new ArrayList<>();
            List<Set<Bound>> upperSets = new ArrayList<>();
            var iter = current.entrySet().iterator();
            while (iter.hasNext()) {
                var entry = iter.next();
                Context context = entry.getValue();
                FourierMotzkin fm = new FourierMotzkin(context.constrains).eliminateAll(context.unknowns());
                if (fm.empty) {
                    logger.debug("{} has no instance under {}", entry.getKey(), iterator);
                    iter.remove();
                    continue;
                }
                var lower = fm.lowerBounds(iterator);
                var upper = fm.upperBounds(iterator);
                if (lower.isEmpty() || upper.isEmpty()) {
                    throw new ToolkitFailure("loop " + iterator + " of " + entry.getKey() + " has no "
                            + (lower.isEmpty() ? "lower" : "upper") + " bound");
                }
                lowerSets.add(new LinkedHashSet<>(lower));
                upperSets.add(new LinkedHashSet<>(upper));
            }
            if (current.isEmpty()) {
                return null;
            }
            boolean uniform = lowerSets.stream().allMatch(lowerSets.get(0)::equals)
                    && upperSets.stream().allMatch(upperSets.get(0)::equals);
            if (uniform) {
                lowers.add(LoopBound.max(wrap(lowerSets.get(0))));
                uppers.add(LoopBound.min(wrap(upperSets.get(0))));
                for (Bound bound : lowerSets.get(0)) {
                    known.add(bound.toConstrain(iterator).normalize());
                }
                for (Bound bound : upperSets.get(0)) {
                    known.add(bound.toConstrain(iterator).normalize());
                }
            } else {
                List<LoopBound> stmtLowers = new ArrayList<>();
                List<LoopBound> stmtUppers = new ArrayList<>();
                for (int i = 0; i < lowerSets.size(); ++i) {
                    stmtLowers.add(LoopBound.max(wrap(lowerSets.get(i))));
                    stmtUppers.add(LoopBound.min(wrap(upperSets.get(i))));
                }
                lowers.add(LoopBound.min(stmtLowers));
                uppers.add(LoopBound.max(stmtUppers));
            }
            iterators.add(iterator);
        }
        CodeNode body = visit(band.child, current, depth + band.dims(), known);
        if (body == null) {
            return null;
        }
        for (int k = band.dims() - 1; k >= 0; --k) {
            body = new ForCode(iterators.get(k), lowers.get(k), uppers.get(k), band.loopTypes.get(k), body);
        }
        return body;
    }

    private static List<LoopBound> wrap(Set<Bound> bounds) {
        List<LoopBound> result = new ArrayList<>();
        for (Bound bound : bounds) {
            result.add(LoopBound.of(bound));
        }
        return result;
    }

    private CodeNode visitUser(Context context, int depth, Set<Constrain> guaranteed) {
        List<String> unknowns = context.unknowns();
        List<Constrain> equalities = new ArrayList<>();
        Set<String> knownNames = new TreeSet<>();
        for (Constrain constrain : context.constrains) {
            if (constrain.op == Constrain.EQ && unknowns.stream().anyMatch(constrain.expr::contains)) {
                equalities.add(constrain);
                knownNames.addAll(constrain.expr.coefficient.keySet());
            }
        }
        knownNames.removeAll(unknowns);
        List<String> knowns = new ArrayList<>(knownNames);

        int width = unknowns.size() + knowns.size() + 1;
        Matrix matrix = new Matrix(equalities.size(), width);
        for (int r = 0; r < equalities.size(); ++r) {
            Affine expr = equalities.get(r).expr;
            for (int u = 0; u < unknowns.size(); ++u) {
                matrix.setElement(r, u, new Fraction(expr.getCoe(unknowns.get(u))));
            }
            for (int k = 0; k < knowns.size(); ++k) {
                matrix.setElement(r, unknowns.size() + k, new Fraction(expr.getCoe(knowns.get(k))));
            }
            matrix.setElement(r, width - 1, new Fraction(expr.bias));
        }
        List<Integer> pivots = matrix.reduce(unknowns.size());

        // unknowns without a pivot are scanned by extra loops
        HashMap<String, AffineFraction> values = new HashMap<>();
        List<String> freeLoops = new ArrayList<>();
        for (int u = 0; u < unknowns.size(); ++u) {
            if (!pivots.contains(u)) {
                String iterator = prefix + (depth + freeLoops.size());
                freeLoops.add(iterator);
                values.put(unknowns.get(u), new AffineFraction(Affine.variable(iterator)));
            }
        }
        List<Constrain> integrality = new ArrayList<>();
        for (int r = 0; r < pivots.size(); ++r) {
            int col = pivots.get(r);
            AffineFraction value = new AffineFraction();
            for (int u = 0; u < unknowns.size(); ++u) {
                if (!pivots.contains(u)) {
                    value.merge(values.get(unknowns.get(u)), matrix.getElement(r, u).neg());
                }
            }
            for (int k = 0; k < knowns.size(); ++k) {
                value.addVarCo(knowns.get(k), matrix.getElement(r, unknowns.size() + k).neg());
            }
            value.addBias(matrix.getElement(r, width - 1).neg());
            values.put(unknowns.get(col), value);
            if (!value.isIntegral()) {
                integrality.add(new Constrain(value.numerator(), value.denominator()).normalize());
            }
        }

        List<Constrain> substituted = new ArrayList<>();
        for (Constrain constrain : context.constrains) {
            AffineFraction value = AffineFraction.compose(constrain.expr, values);
            long de = value.denominator();
            Constrain result = constrain.op == Constrain.MOD
                    ? new Constrain(value.numerator(), constrain.modulus * de)
                    : new Constrain(value.numerator(), constrain.op);
            substituted.add(result.normalize());
        }
        substituted.addAll(integrality);
        for (Constrain constrain : substituted) {
            if (constrain.isInfeasible()) {
                logger.debug("{} is never executed here", context.stmt.name);
                return null;
            }
        }

        Set<Constrain> known = new HashSet<>(guaranteed);
        List<LoopBound> lowers = new ArrayList<>();
        List<LoopBound> uppers = new ArrayList<>();
        if (!freeLoops.isEmpty()) {
            FourierMotzkin fm = new FourierMotzkin(substituted);
            for (int i = freeLoops.size() - 1; i >= 0; --i) {
                String iterator = freeLoops.get(i);
                if (fm.empty) {
                    return null;
                }
                var lower = fm.lowerBounds(iterator);
                var upper = fm.upperBounds(iterator);
                if (lower.isEmpty() || upper.isEmpty()) {
                    throw new ToolkitFailure("no finite range for loop " + iterator + " of " + context.stmt.name);
                }
                lowers.add(0, LoopBound.max(wrap(new LinkedHashSet<>(lower))));
                uppers.add(0, LoopBound.min(wrap(new LinkedHashSet<>(upper))));
                for (Bound bound : lower) {
                    known.add(bound.toConstrain(iterator).normalize());
                }
                for (Bound bound : upper) {
                    known.add(bound.toConstrain(iterator).normalize());
                }
                fm.eliminate(iterator);
            }
        }

        LinkedHashSet<Constrain> guard = new LinkedHashSet<>();
        for (Constrain constrain : substituted) {
            if (!constrain.isTrivial() && !known.contains(constrain)) {
                guard.add(constrain);
            }
        }
        LinkedHashMap<String, AffineFraction> iteratorValues = new LinkedHashMap<>();
        for (String iterator : context.stmt.iterators) {
            iteratorValues.put(iterator, values.get(iterator));
        }
        CodeNode body = new UserCode(context.stmt, iteratorValues);
        if (!guard.isEmpty()) {
            body = new IfCode(new ArrayList<>(guard), body);
        }
        for (int i = freeLoops.size() - 1; i >= 0; --i) {
            body = new ForCode(freeLoops.get(i), lowers.get(i), uppers.get(i), LoopType.DEFAULT, body);
        }
        return body;
    }
}
