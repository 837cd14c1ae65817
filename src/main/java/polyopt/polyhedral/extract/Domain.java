package polyopt.polyhedral.extract;

import polyopt.AST.Program;
import polyopt.AST.expression.*;
import polyopt.AST.statement.Statement;
import polyopt.AST.statement.loopStatement.ForLoop;
import polyopt.AST.statement.selectStatement.SelectStatement;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.BasicSet;
import polyopt.polyhedral.affine.Constrain;
import polyopt.polyhedral.affine.MultiUnionPwAff;
import polyopt.polyhedral.affine.QuasiAffine;
import polyopt.polyhedral.affine.UnionPwAff;
import polyopt.polyhedral.affine.UnionSet;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.DomainNode;
import polyopt.polyhedral.schedule.FilterNode;
import polyopt.polyhedral.schedule.LeafNode;
import polyopt.polyhedral.schedule.ScheduleNode;
import polyopt.polyhedral.schedule.SequenceNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Stack;

/**
 * Statements, iteration domains and the initial schedule tree of one scop:
 * a sequence of filters for every block with several items, one band per
 * loop, a leaf per statement.
 */
public class Domain {
    public List<Index> indexList;
    public List<Assign> stmtList;
    public LinkedHashSet<String> parameters;
    public UnionSet domain;
    public DomainNode schedule;

    private final Stack<Index> loops;
    private final Stack<List<Constrain>> guards;
    private final HashSet<String> writtenScalars;

    public Domain(Program program) {
        indexList = new ArrayList<>();
        stmtList = new ArrayList<>();
        parameters = new LinkedHashSet<>();
        loops = new Stack<>();
        guards = new Stack<>();
        writtenScalars = new HashSet<>();
        collectScalars(program.statementList);
        ScheduleNode body = getStmtList(program.statementList);
        if (stmtList.isEmpty()) {
            throw new ToolkitFailure("scop without statements");
        }
        List<String> params = new ArrayList<>(parameters);
        List<BasicSet> sets = new ArrayList<>();
        for (Assign assign : stmtList) {
            assign.domain = new BasicSet(assign.name, assign.iterators, params, assign.constrains);
            sets.add(assign.domain);
        }
        domain = new UnionSet(params, sets);
        schedule = new DomainNode(domain, attachParams(body, params));
    }

    public Assign getAssign(String name) {
        for (Assign assign : stmtList) {
            if (assign.name.equals(name)) {
                return assign;
            }
        }
        throw new ToolkitFailure("unknown statement " + name);
    }

    private void collectScalars(List<Statement> statements) {
        for (Statement statement : statements) {
            if (statement.suite != null) {
                collectScalars(statement.suite.statementList);
            } else if (statement.loopStatement != null) {
                collectScalars(List.of(statement.loopStatement.stmt));
            } else if (statement.selectStatement != null) {
                collectScalars(List.of(statement.selectStatement.trueStmt));
            } else if (statement.exp != null) {
                Expression target = null;
                if (statement.exp instanceof AssignExp assign) {
                    target = assign.lhs;
                } else if (statement.exp instanceof PrefixLhsExp prefix) {
                    target = prefix.exp;
                } else if (statement.exp instanceof PostfixExp postfix) {
                    target = postfix.exp;
                }
                if (target instanceof VariableLhsExp variable) {
                    writtenScalars.add(variable.variableName);
                }
            }
        }
    }

    private ScheduleNode getStmtList(List<Statement> statements) {
        List<ScheduleNode> children = new ArrayList<>();
        List<List<String>> names = new ArrayList<>();
        for (Statement statement : statements) {
            int first = stmtList.size();
            ScheduleNode node = getStmt(statement);
            if (node == null) {
                continue;
            }
            List<String> reached = new ArrayList<>();
            for (int i = first; i < stmtList.size(); ++i) {
                reached.add(stmtList.get(i).name);
            }
            if (reached.isEmpty()) {
                continue;
            }
            children.add(node);
            names.add(reached);
        }
        if (children.isEmpty()) {
            return null;
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        List<ScheduleNode> filters = new ArrayList<>();
        for (int i = 0; i < children.size(); ++i) {
            filters.add(new FilterNode(names.get(i), children.get(i)));
        }
        return new SequenceNode(filters);
    }

    private ScheduleNode getStmt(Statement statement) {
        if (statement.suite != null) {
            return getStmtList(statement.suite.statementList);
        }
        if (statement.loopStatement != null) {
            return getLoop(statement.loopStatement);
        }
        if (statement.selectStatement != null) {
            return getSelect(statement.selectStatement);
        }
        if (statement.exp != null) {
            return getAssign(statement.exp, statement.line);
        }
        return null;
    }

    private ScheduleNode getLoop(ForLoop forLoop) {
        String index = forLoop.varName;
        for (Index loop : loops) {
            if (loop.varName.equals(index)) {
                throw failure(forLoop.line, "iterator " + index + " shadows an enclosing loop");
            }
        }
        if (writtenScalars.contains(index)) {
            throw failure(forLoop.line, "iterator " + index + " is assigned in the loop body");
        }
        Index indexNew = new Index(index, "L_" + indexList.size());
        indexList.add(indexNew);

        Affine from = getAffine(forLoop.initExp, forLoop.line);
        indexNew.boundFrom = from;
        indexNew.step = getStep(forLoop.stepExp, index, forLoop.line);
        Affine sinceStart = Affine.variable(index).merge(from, -1);
        if (indexNew.step > 0) {
            indexNew.constrains.add(new Constrain(new Affine(sinceStart), Constrain.GE));
        } else {
            indexNew.constrains.add(new Constrain(new Affine(sinceStart).mul(-1), Constrain.GE));
        }
        if (Math.abs(indexNew.step) != 1) {
            indexNew.constrains.add(new Constrain(sinceStart, Math.abs(indexNew.step)));
        }
        loops.push(indexNew);
        indexNew.constrains.addAll(getCondition(forLoop.conditionExp, forLoop.line));
        guards.push(indexNew.constrains);

        int first = stmtList.size();
        ScheduleNode body = getStmt(forLoop.stmt);
        guards.pop();
        loops.pop();
        if (body == null || first == stmtList.size()) {
            return null;
        }
        List<UnionPwAff.Piece> pieces = new ArrayList<>();
        for (int i = first; i < stmtList.size(); ++i) {
            Assign assign = stmtList.get(i);
            QuasiAffine expr = QuasiAffine.variable(index);
            pieces.add(new UnionPwAff.Piece(assign.name, assign.iterators, indexNew.decreasing() ? expr.mul(-1) : expr));
        }
        UnionPwAff dim = new UnionPwAff(pieces);
        return new BandNode(new MultiUnionPwAff(indexNew.bandId, List.of(), List.of(dim)), body);
    }

    private long getStep(Expression exp, String index, int line) {
        if (exp instanceof PostfixExp postfix && isVariable(postfix.exp, index)) {
            return postfix.op.equals("++") ? 1 : -1;
        }
        if (exp instanceof PrefixLhsExp prefix && isVariable(prefix.exp, index)) {
            return prefix.op.equals("++") ? 1 : -1;
        }
        if (exp instanceof AssignExp assign && isVariable(assign.lhs, index)) {
            Long value;
            switch (assign.op) {
                case "+=" -> value = getNumber(assign.rhs);
                case "-=" -> {
                    value = getNumber(assign.rhs);
                    value = value == null ? null : -value;
                }
                case "=" -> {
                    Affine rhs = toAffine(assign.rhs);
                    value = null;
                    if (rhs != null && rhs.coefficient.size() == 1 && rhs.getCoe(index) == 1) {
                        value = rhs.bias;
                    }
                }
                default -> value = null;
            }
            if (value != null && value != 0) {
                return value;
            }
        }
        throw failure(line, "loop increment must be a non-zero constant step of " + index);
    }

    private static boolean isVariable(Expression exp, String name) {
        return exp instanceof VariableLhsExp variable && variable.variableName.equals(name);
    }

    private ScheduleNode getSelect(SelectStatement select) {
        guards.push(getCondition(select.judgeExp, select.line));
        ScheduleNode node = getStmt(select.trueStmt);
        guards.pop();
        return node;
    }

    /**
     * A conjunction of affine comparisons.
     */
    private List<Constrain> getCondition(Expression exp, int line) {
        List<Constrain> result = new ArrayList<>();
        if (exp instanceof BinaryExp binary && binary.op.equals("&&")) {
            result.addAll(getCondition(binary.lhs, line));
            result.addAll(getCondition(binary.rhs, line));
            return result;
        }
        if (!(exp instanceof BinaryExp cond)) {
            throw failure(line, "condition must be a conjunction of affine comparisons");
        }
        Affine lhs = getAffine(cond.lhs, line);
        Affine rhs = getAffine(cond.rhs, line);
        switch (cond.op) {
            case "<" -> result.add(Constrain.ge(rhs, lhs.addBias(1)));
            case "<=" -> result.add(Constrain.ge(rhs, lhs));
            case ">" -> result.add(Constrain.ge(lhs, rhs.addBias(1)));
            case ">=" -> result.add(Constrain.ge(lhs, rhs));
            case "==" -> result.add(Constrain.eq(lhs, rhs));
            default -> throw failure(line, "unsupported comparison " + cond.op);
        }
        return result;
    }

    private ScheduleNode getAssign(Expression exp, int line) {
        List<String> iterators = new ArrayList<>();
        List<Constrain> constrains = new ArrayList<>();
        for (Index loop : loops) {
            iterators.add(loop.varName);
        }
        for (List<Constrain> guard : guards) {
            constrains.addAll(guard);
        }
        Assign assign = new Assign("S_" + stmtList.size(), iterators, constrains);
        assign.exp = exp;
        assign.line = line;
        if (exp instanceof AssignExp assignExp) {
            MemVisit write = getMem(assignExp.lhs, line);
            if (!assignExp.op.equals("=")) {
                assign.setRead(new MemVisit(write));
            }
            getAssignRhs(assignExp.rhs, assign, line);
            assign.setWrite(write);
        } else if (exp instanceof PrefixLhsExp prefix) {
            MemVisit write = getMem(prefix.exp, line);
            assign.setRead(new MemVisit(write));
            assign.setWrite(write);
        } else if (exp instanceof PostfixExp postfix) {
            MemVisit write = getMem(postfix.exp, line);
            assign.setRead(new MemVisit(write));
            assign.setWrite(write);
        } else {
            throw failure(line, "statement must be an assignment");
        }
        stmtList.add(assign);
        return new LeafNode();
    }

    private void getAssignRhs(Expression exp, Assign assign, int line) {
        if (exp instanceof ArrayElementLhsExp) {
            assign.setRead(getMem(exp, line));
        } else if (exp instanceof VariableLhsExp variable) {
            if (!isIterator(variable.variableName)) {
                assign.setRead(getMem(exp, line));
            }
        } else if (exp instanceof BinaryExp binary) {
            getAssignRhs(binary.lhs, assign, line);
            getAssignRhs(binary.rhs, assign, line);
        } else if (exp instanceof UnaryExp unary) {
            getAssignRhs(unary.exp, assign, line);
        } else if (exp instanceof TernaryExp ternary) {
            getAssignRhs(ternary.condition, assign, line);
            getAssignRhs(ternary.trueExp, assign, line);
            getAssignRhs(ternary.falseExp, assign, line);
        } else if (exp instanceof FunctionCallLhsExp call) {
            for (Expression arg : call.callExpList) {
                getAssignRhs(arg, assign, line);
            }
        } else if (!(exp instanceof NumberExp) && !(exp instanceof FloatExp)) {
            throw failure(line, "side effect inside an expression");
        }
    }

    private MemVisit getMem(Expression exp, int line) {
        if (exp instanceof VariableLhsExp variable) {
            if (isIterator(variable.variableName)) {
                throw failure(line, "iterator " + variable.variableName + " used as a memory location");
            }
            MemVisit memVisit = new MemVisit();
            memVisit.setVarName(variable.variableName);
            return memVisit;
        }
        if (exp instanceof ArrayElementLhsExp element) {
            if (!(element.variable instanceof VariableLhsExp) && !(element.variable instanceof ArrayElementLhsExp)) {
                throw failure(line, "unsupported array expression");
            }
            MemVisit memVisit = getMem(element.variable, line);
            memVisit.addDim(getAffine(element.index, line));
            return memVisit;
        }
        throw failure(line, "unsupported memory access");
    }

    private boolean isIterator(String name) {
        for (Index loop : loops) {
            if (loop.varName.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private Affine getAffine(Expression exp, int line) {
        Affine affine = toAffine(exp);
        if (affine == null) {
            throw failure(line, "expression is not affine in iterators and parameters");
        }
        for (String name : affine.coefficient.keySet()) {
            if (!isIterator(name)) {
                parameters.add(name);
            }
        }
        return affine;
    }

    private Long getNumber(Expression exp) {
        Affine affine = toAffine(exp);
        return affine != null && affine.isConst() ? affine.bias : null;
    }

    private Affine toAffine(Expression exp) {
        return AffineExpressions.toAffine(exp, name -> !writtenScalars.contains(name));
    }

    private static ScheduleNode attachParams(ScheduleNode node, List<String> params) {
        if (node == null) {
            return new LeafNode();
        }
        if (node instanceof BandNode band) {
            var schedule = new MultiUnionPwAff(band.schedule.tupleId, params, band.schedule.dims);
            return new BandNode(schedule, band.loopTypes, attachParams(band.child, params));
        }
        List<ScheduleNode> children = new ArrayList<>();
        for (ScheduleNode child : node.children()) {
            children.add(attachParams(child, params));
        }
        return children.isEmpty() ? node : node.withChildren(children);
    }

    private static ToolkitFailure failure(int line, String message) {
        return new ToolkitFailure("line " + line + ": " + message);
    }
}
