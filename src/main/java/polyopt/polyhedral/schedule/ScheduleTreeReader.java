package polyopt.polyhedral.schedule;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import polyopt.Util.error.ParserErrorListener;
import polyopt.Util.error.ToolkitFailure;
import polyopt.parser.ScheduleLexer;
import polyopt.parser.ScheduleParser;
import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.BasicSet;
import polyopt.polyhedral.affine.Constrain;
import polyopt.polyhedral.affine.MultiUnionPwAff;
import polyopt.polyhedral.affine.QuasiAffine;
import polyopt.polyhedral.affine.UnionPwAff;
import polyopt.polyhedral.affine.UnionSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the text {@link ScheduleTreePrinter} writes. The tree is validated
 * against its own domain before it is returned.
 */
public class ScheduleTreeReader {
    private final QuasiBuilder quasiBuilder = new QuasiBuilder();
    private UnionSet domain;

    public DomainNode read(String text) {
        ScheduleParser parser = parser(text);
        ScheduleNode node = readNode(parser.tree().node());
        if (!(node instanceof DomainNode root)) {
            throw new ToolkitFailure("a schedule tree must start with a domain");
        }
        ScheduleValidator.validate(root);
        return root;
    }

    /**
     * Reads a tree and checks that its domain has the same statements and
     * dimensions as {@code expected}; the expected domain is kept.
     */
    public DomainNode read(String text, UnionSet expected) {
        DomainNode root = read(text);
        if (!root.domain.names().equals(expected.names())) {
            throw new ToolkitFailure("schedule domain " + root.domain.names() + " does not match " + expected.names());
        }
        for (String name : expected.names()) {
            if (root.domain.get(name).dims.size() != expected.get(name).dims.size()) {
                throw new ToolkitFailure("statement " + name + " has " + expected.get(name).dims.size() + " dimensions");
            }
        }
        DomainNode result = new DomainNode(expected, rename(root.child, root.domain, expected));
        ScheduleValidator.validate(result);
        return result;
    }

    private static ScheduleParser parser(String text) {
        ScheduleLexer lexer = new ScheduleLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ParserErrorListener());
        ScheduleParser parser = new ScheduleParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(new ParserErrorListener());
        return parser;
    }

    private ScheduleNode readNode(ScheduleParser.NodeContext ctx) {
        Map<String, ScheduleParser.ValueContext> entries = new LinkedHashMap<>();
        for (var entry : ctx.entry()) {
            if (entries.put(entry.key.getText(), entry.value()) != null) {
                throw new ToolkitFailure("duplicate key " + entry.key.getText());
            }
        }
        ScheduleNode child = entries.containsKey("child") ? readNode(nodeOf(entries.get("child"))) : new LeafNode();
        if (entries.containsKey("domain")) {
            expectKeys(entries, "domain", "child");
            domain = parseUnionSet(stringOf(entries.get("domain")));
            return new DomainNode(domain, child);
        }
        if (domain == null) {
            throw new ToolkitFailure("a schedule tree must start with a domain");
        }
        if (entries.containsKey("schedule")) {
            expectKeys(entries, "schedule", "loop", "child");
            MultiUnionPwAff schedule = parseSchedule(stringOf(entries.get("schedule")));
            if (!entries.containsKey("loop")) {
                return new BandNode(schedule, child);
            }
            if (!(entries.get("loop") instanceof ScheduleParser.ListValueContext list)) {
                throw new ToolkitFailure("loop must be a list");
            }
            List<LoopType> types = new ArrayList<>();
            for (var value : list.value()) {
                types.add(LoopType.parse(value.getText()));
            }
            if (types.size() != schedule.size()) {
                throw new ToolkitFailure("loop has " + types.size() + " entries for " + schedule.size() + " dimensions");
            }
            return new BandNode(schedule, types, child);
        }
        if (entries.containsKey("sequence") || entries.containsKey("set")) {
            boolean sequence = entries.containsKey("sequence");
            expectKeys(entries, sequence ? "sequence" : "set");
            if (!(entries.get(sequence ? "sequence" : "set") instanceof ScheduleParser.ListValueContext list)) {
                throw new ToolkitFailure("sequence and set take a list of filters");
            }
            List<ScheduleNode> children = new ArrayList<>();
            for (var value : list.value()) {
                children.add(readNode(nodeOf(value)));
            }
            return sequence ? new SequenceNode(children) : new SetNode(children);
        }
        if (entries.containsKey("filter")) {
            expectKeys(entries, "filter", "child");
            UnionSet filter = parseUnionSet(stringOf(entries.get("filter")));
            return new FilterNode(filter.names(), child);
        }
        throw new ToolkitFailure("unknown schedule node with keys " + entries.keySet());
    }

    private static void expectKeys(Map<String, ?> entries, String... allowed) {
        for (String key : entries.keySet()) {
            if (!List.of(allowed).contains(key)) {
                throw new ToolkitFailure("unexpected key " + key);
            }
        }
    }

    private static ScheduleParser.NodeContext nodeOf(ScheduleParser.ValueContext value) {
        if (value instanceof ScheduleParser.NodeValueContext node) {
            return node.node();
        }
        throw new ToolkitFailure("expected a node, found " + value.getText());
    }

    private static String stringOf(ScheduleParser.ValueContext value) {
        if (value instanceof ScheduleParser.StringValueContext string) {
            String text = string.StringLiteral().getText();
            return text.substring(1, text.length() - 1);
        }
        throw new ToolkitFailure("expected a string, found " + value.getText());
    }

    private static List<String> params(ScheduleParser.ParamsContext ctx) {
        List<String> result = new ArrayList<>();
        if (ctx != null) {
            ctx.Identifier().forEach(id -> result.add(id.getText()));
        }
        return result;
    }

    private static List<String> dims(ScheduleParser.TupleContext ctx) {
        List<String> result = new ArrayList<>();
        for (int i = 1; i < ctx.Identifier().size(); ++i) {
            result.add(ctx.Identifier(i).getText());
        }
        return result;
    }

    public UnionSet parseUnionSet(String text) {
        var ctx = parser(text).unionSetText();
        List<String> params = params(ctx.params());
        List<BasicSet> sets = new ArrayList<>();
        for (var basic : ctx.basicSet()) {
            List<Constrain> constrains = new ArrayList<>();
            for (var constraint : basic.constraint()) {
                constrains.addAll(constraint(constraint));
            }
            sets.add(new BasicSet(basic.tuple().Identifier(0).getText(), dims(basic.tuple()), params, constrains));
        }
        return new UnionSet(params, sets);
    }

    public MultiUnionPwAff parseSchedule(String text) {
        var ctx = parser(text).multiUnionPwAffText();
        List<String> params = params(ctx.params());
        List<UnionPwAff> dims = new ArrayList<>();
        for (var upa : ctx.unionPwAff()) {
            List<UnionPwAff.Piece> pieces = new ArrayList<>();
            for (var piece : upa.piece()) {
                pieces.add(new UnionPwAff.Piece(piece.tuple().Identifier(0).getText(), dims(piece.tuple()),
                        quasiBuilder.visit(piece.quasi())));
            }
            dims.add(new UnionPwAff(pieces));
        }
        if (dims.isEmpty()) {
            throw new ToolkitFailure("a band needs at least one dimension");
        }
        String tupleId = ctx.Identifier() == null ? "" : ctx.Identifier().getText();
        return new MultiUnionPwAff(tupleId, params, dims);
    }

    private Affine affine(ScheduleParser.QuasiContext ctx) {
        QuasiAffine value = quasiBuilder.visit(ctx);
        if (!value.isAffine()) {
            throw new ToolkitFailure("floor in a set constraint: " + ctx.getText());
        }
        return value.linear();
    }

    private List<Constrain> constraint(ScheduleParser.ConstraintContext ctx) {
        List<Constrain> result = new ArrayList<>();
        if (ctx instanceof ScheduleParser.ModConstraintContext mod) {
            Affine expr = affine(mod.quasi(0)).merge(affine(mod.quasi(1)), -1);
            result.add(new Constrain(expr, Long.parseLong(mod.IntLiteral().getText())));
            return result;
        }
        var compare = (ScheduleParser.CompareConstraintContext) ctx;
        for (int i = 0; i < compare.cmp().size(); ++i) {
            Affine lhs = affine(compare.quasi(i));
            Affine rhs = affine(compare.quasi(i + 1));
            switch (compare.cmp(i).op.getText()) {
                case "=" -> result.add(Constrain.eq(lhs, rhs));
                case "<" -> result.add(Constrain.ge(rhs, lhs.addBias(1)));
                case "<=" -> result.add(Constrain.ge(rhs, lhs));
                case ">" -> result.add(Constrain.ge(lhs, rhs.addBias(1)));
                default -> result.add(Constrain.ge(lhs, rhs));
            }
        }
        return result;
    }

    // pieces may name iterators differently from the domain
    private static ScheduleNode rename(ScheduleNode node, UnionSet from, UnionSet to) {
        if (node instanceof BandNode band) {
            MultiUnionPwAff schedule = band.schedule.map(dim -> {
                List<UnionPwAff.Piece> result = new ArrayList<>();
                for (var piece : dim.pieces.values()) {
                    List<String> target = to.get(piece.name).dims;
                    if (piece.dims.size() != target.size()) {
                        throw new ToolkitFailure("piece " + piece + " does not match " + to.get(piece.name).tupleString());
                    }
                    Map<String, String> names = new HashMap<>();
                    for (int i = 0; i < target.size(); ++i) {
                        names.put(piece.dims.get(i), target.get(i));
                    }
                    result.add(new UnionPwAff.Piece(piece.name, target, piece.expr.rename(names)));
                }
                return new UnionPwAff(result);
            });
            return new BandNode(new MultiUnionPwAff(schedule.tupleId, to.params, schedule.dims), band.loopTypes,
                    rename(band.child, from, to));
        }
        List<ScheduleNode> children = new ArrayList<>();
        for (ScheduleNode child : node.children()) {
            children.add(rename(child, from, to));
        }
        return children.isEmpty() ? node : node.withChildren(children);
    }
}
