package polyopt.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.Util.config.Configuration;
import polyopt.Util.error.OperatorPrecondition;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.UnionPwAff;
import polyopt.polyhedral.dependency.Model;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;
import polyopt.polyhedral.legality.LegalityChecker;
import polyopt.polyhedral.rebuild.CodeGenerator;
import polyopt.polyhedral.rebuild.CodeNode;
import polyopt.polyhedral.rebuild.CodePrinter;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.LoopType;
import polyopt.polyhedral.schedule.NodeKind;
import polyopt.polyhedral.schedule.ScheduleCursor;
import polyopt.polyhedral.schedule.ScheduleTreePrinter;
import polyopt.polyhedral.schedule.ScheduleTreeReader;
import polyopt.polyhedral.transform.Fuse;
import polyopt.polyhedral.transform.Interchange;
import polyopt.polyhedral.transform.LoopHint;
import polyopt.polyhedral.transform.Scale;
import polyopt.polyhedral.transform.Shift;
import polyopt.polyhedral.transform.Tile;
import polyopt.polyhedral.transform.Transformation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * One static control part: its statements, dependences and the schedule tree
 * being edited.
 * <p>
 * An edit is a transaction: {@link #preTransform()} stages a copy of the
 * current tree, one operator rewrites the staged tree, and
 * {@link #postTransform()} swaps it in and returns whether it is legal. An
 * illegal edit stays in place until the caller rolls it back.
 * <p>
 * Verdicts enumerate statement instances, so every parameter needs a value:
 * a {@code #define} or {@code const int} in the source, or
 * {@link Configuration#setParam}. A scop with a free parameter is kept as is
 * and its {@link #failure()} names the parameter.
 */
public class Scop {
    private static final Logger logger = LoggerFactory.getLogger(Scop.class);

    public final ScopSource source;
    private final Configuration config;
    private final ToolkitFailure failure;
    private Domain domain;
    private Model model;
    private LegalityChecker checker;
    private ScheduleCursor current;
    private ScheduleCursor staged;
    private boolean modified;
    private final List<String> arena;
    private boolean released;

    Scop(ScopSource source_, Configuration config_, Map<String, Long> sourceParams) {
        source = source_;
        config = config_;
        arena = new ArrayList<>();
        ToolkitFailure error = null;
        try {
            domain = new Domain(Extractor.parse(source));
            HashMap<String, Long> params = new HashMap<>();
            for (String name : domain.parameters) {
                Long value = config.params.containsKey(name) ? config.params.get(name) : sourceParams.get(name);
                if (value == null) {
                    throw new ToolkitFailure("no value for parameter " + name);
                }
                params.put(name, value);
            }
            model = new Model(domain, params, config.dependenceKinds, config.maxInstances);
            checker = new LegalityChecker(model.instances, params, model.dependences);
            current = new ScheduleCursor(domain.schedule);
            logger.info("scop {}: {} statements, {} instances, {}", source.index, domain.stmtList.size(),
                    model.instances.size(), model.dependences);
        } catch (ToolkitFailure e) {
            logger.warn("scop {} (line {}) is kept as is: {}", source.index, source.firstLine, e.getMessage());
            error = e;
        }
        failure = error;
    }

    private void check() {
        if (released) {
            throw new IllegalStateException("scop " + source.index + " has been released");
        }
        if (failure != null) {
            throw new ToolkitFailure(failure.getMessage(), failure);
        }
    }

    private String keep(String text) {
        arena.add(text);
        return text;
    }

    public ToolkitFailure failure() {
        return failure;
    }

    public boolean isModified() {
        return modified;
    }

    public Domain domain() {
        check();
        return domain;
    }

    public Model model() {
        check();
        return model;
    }

    public ScheduleCursor cursor() {
        check();
        return current;
    }

    public ScheduleCursor staged() {
        check();
        return staged;
    }

    public int arenaSize() {
        return arena.size();
    }

    // navigation

    public void gotoRoot() {
        check();
        current = current.root();
    }

    public void gotoParent() {
        check();
        current = current.parent();
    }

    public void gotoChild(int pos) {
        check();
        current = current.child(pos);
    }

    public void gotoPath(String path) {
        check();
        current = current.follow(path);
    }

    public NodeKind nodeKind() {
        check();
        return current.node().kind();
    }

    public int childCount() {
        check();
        return current.node().childCount();
    }

    /**
     * Partial schedule of the band at the cursor, empty for other nodes.
     */
    public String bandExprText() {
        check();
        if (!(current.node() instanceof BandNode band)) {
            return keep("");
        }
        return keep(band.schedule.toString());
    }

    /**
     * Parameters and iterators of every statement of the band at the cursor,
     * e.g. {@code [{'params' : ['N'], 'vars' : ['i', 'j']}]}.
     */
    public String bandSignature() {
        check();
        if (!(current.node() instanceof BandNode band) || band.dims() == 0) {
            return keep("[]");
        }
        List<String> pieces = new ArrayList<>();
        String params = quoted(band.schedule.params);
        for (UnionPwAff.Piece piece : band.schedule.get(0).pieceList()) {
            pieces.add("{'params' : " + params + ", 'vars' : " + quoted(piece.dims) + "}");
        }
        return keep("[" + String.join(", ", pieces) + "]");
    }

    private static String quoted(List<String> names) {
        List<String> result = new ArrayList<>();
        for (String name : names) {
            result.add("'" + name + "'");
        }
        return "[" + String.join(", ", result) + "]";
    }

    public String printScheduleNode() {
        check();
        return keep(new ScheduleTreePrinter(current.domain()).print(current.node()));
    }

    public String scheduleText() {
        check();
        return keep(new ScheduleTreePrinter(current.domain()).print(current.rootNode()));
    }

    // transactions

    public ScheduleCursor preTransform() {
        check();
        staged = current;
        return staged;
    }

    /**
     * Replaces the staged tree with an operator's result.
     */
    public void stage(ScheduleCursor cursor) {
        check();
        if (staged == null) {
            throw new IllegalStateException("no transaction in progress");
        }
        staged = cursor;
    }

    public boolean postTransform() {
        return commit(cursor -> checker.isLegal(cursor.rootNode()));
    }

    private boolean commit(Predicate<ScheduleCursor> verdict) {
        check();
        if (staged == null) {
            throw new IllegalStateException("no transaction in progress");
        }
        boolean legal = verdict.test(staged);
        ScheduleCursor previous = current;
        current = staged;
        staged = previous;
        modified = true;
        logger.debug("scop {}: committed, legal = {}", source.index, legal);
        return legal;
    }

    public void rollback() {
        check();
        if (staged == null) {
            logger.info("scop {}: nothing to roll back", source.index);
            return;
        }
        ScheduleCursor previous = current;
        current = staged;
        staged = previous;
        logger.debug("scop {}: rolled back", source.index);
    }

    private ScheduleCursor apply(UnaryOperator<ScheduleCursor> operator) {
        ScheduleCursor cursor = preTransform();
        try {
            cursor = operator.apply(cursor);
        } catch (RuntimeException e) {
            staged = null;
            throw e;
        }
        stage(cursor);
        return cursor;
    }

    private boolean run(UnaryOperator<ScheduleCursor> operator) {
        apply(operator);
        return postTransform();
    }

    public boolean tile(long size) {
        return run(cursor -> Tile.tile(cursor, size));
    }

    public boolean interchange() {
        return run(Interchange::interchange);
    }

    public boolean fuse(int i, int j) {
        return run(cursor -> Fuse.fuse(cursor, i, j));
    }

    public boolean fuseAll() {
        return run(Fuse::fuseAll);
    }

    public boolean fullShiftValue(long value) {
        return run(cursor -> Shift.fullShiftValue(cursor, value));
    }

    public boolean fullShiftVariable(long coefficient, int var) {
        return run(cursor -> Shift.fullShiftVariable(cursor, coefficient, var));
    }

    public boolean fullShiftParam(long coefficient, int param) {
        return run(cursor -> Shift.fullShiftParam(cursor, coefficient, param));
    }

    public boolean partialShiftValue(int stmt, long value) {
        return run(cursor -> Shift.partialShiftValue(cursor, stmt, value));
    }

    public boolean partialShiftVariable(int stmt, long coefficient, int var) {
        return run(cursor -> Shift.partialShiftVariable(cursor, stmt, coefficient, var));
    }

    public boolean partialShiftParam(int stmt, long coefficient, int param) {
        return run(cursor -> Shift.partialShiftParam(cursor, stmt, coefficient, param));
    }

    public boolean scale(long factor) {
        return run(cursor -> Scale.scale(cursor, factor));
    }

    /**
     * Marks the first dimension of the band parallel. The verdict is whether
     * no dependence is carried by that dimension.
     */
    public boolean setParallel() {
        apply(LoopHint::setParallel);
        return commit(checker::isParallel);
    }

    /**
     * Attaches a hint outside any transaction; the schedule does not change.
     */
    public void setLoopOpt(int pos, LoopType type) {
        check();
        current = LoopHint.setLoopOpt(current, pos, type);
        modified = true;
    }

    /**
     * Replaces the whole tree with one read from text, keeping the cursor at
     * the root.
     */
    public boolean loadSchedule(String text) {
        check();
        ScheduleCursor loaded = new ScheduleCursor(new ScheduleTreeReader().read(text, domain.domain));
        preTransform();
        stage(loaded);
        return postTransform();
    }

    public boolean transform(Transformation transformation, String... args) {
        check();
        if (args.length != transformation.argCount) {
            throw new OperatorPrecondition(transformation.command + " takes " + transformation.argCount
                    + " arguments, got " + args.length);
        }
        return switch (transformation) {
            case TILE -> tile(number(args[0]));
            case INTERCHANGE -> interchange();
            case FUSE -> fuse(index(args[0]), index(args[1]));
            case FUSE_ALL -> fuseAll();
            case FULL_SHIFT_VALUE -> fullShiftValue(number(args[0]));
            case FULL_SHIFT_VARIABLE -> fullShiftVariable(number(args[0]), index(args[1]));
            case FULL_SHIFT_PARAM -> fullShiftParam(number(args[0]), index(args[1]));
            case PARTIAL_SHIFT_VALUE -> partialShiftValue(index(args[0]), number(args[1]));
            case PARTIAL_SHIFT_VARIABLE -> partialShiftVariable(index(args[0]), number(args[1]), index(args[2]));
            case PARTIAL_SHIFT_PARAM -> partialShiftParam(index(args[0]), number(args[1]), index(args[2]));
            case SCALE -> scale(number(args[0]));
            case PARALLEL -> setParallel();
            case LOOP_OPT -> {
                setLoopOpt(index(args[0]), LoopType.parse(args[1]));
                yield true;
            }
        };
    }

    private static long number(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new OperatorPrecondition("not a number: " + text);
        }
    }

    private static int index(String text) {
        try {
            return Math.toIntExact(number(text));
        } catch (ArithmeticException e) {
            throw new OperatorPrecondition("index out of range: " + text);
        }
    }

    /**
     * C text for the region body: the original text when the scop is
     * unmodified or could not be analysed.
     */
    public String generateCode() {
        if (released) {
            throw new IllegalStateException("scop " + source.index + " has been released");
        }
        if (failure != null || !modified) {
            return source.text;
        }
        CodeNode code = new CodeGenerator(domain, config.iteratorPrefix).generate(current.rootNode());
        return new CodePrinter(source.indent, config.indent).print(code);
    }

    /**
     * Drops the dependences, both trees and the string arena, in that order.
     */
    void release() {
        if (model != null) {
            model.dependences.release();
        }
        current = null;
        staged = null;
        arena.clear();
        released = true;
    }
}
