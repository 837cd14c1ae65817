package polyopt.AST;

import polyopt.AST.expression.*;
import polyopt.AST.statement.Statement;
import polyopt.AST.statement.Suite;
import polyopt.AST.statement.loopStatement.ForLoop;
import polyopt.AST.statement.selectStatement.SelectStatement;
import polyopt.parser.LoopBaseVisitor;
import polyopt.parser.LoopParser;

import java.util.ArrayList;
import java.util.List;

public class ASTBuilder extends LoopBaseVisitor<ASTNode> {
    @Override
    public ASTNode visitScop(LoopParser.ScopContext ctx) {
        Program program = new Program();
        program.line = ctx.getStart().getLine();
        for (var stmt : ctx.statement()) {
            program.statementList.add((Statement) visit(stmt));
        }
        return program;
    }

    @Override
    public ASTNode visitStatement(LoopParser.StatementContext ctx) {
        Statement statement = new Statement();
        statement.line = ctx.getStart().getLine();
        if (ctx.suite() != null) {
            statement.suite = (Suite) visit(ctx.suite());
        } else if (ctx.forLoop() != null) {
            statement.loopStatement = (ForLoop) visit(ctx.forLoop());
        } else if (ctx.selectStatement() != null) {
            statement.selectStatement = (SelectStatement) visit(ctx.selectStatement());
        } else if (ctx.exprStatement() != null) {
            statement.exp = (Expression) visit(ctx.exprStatement().expression());
        }
        return statement;
    }

    @Override
    public ASTNode visitSuite(LoopParser.SuiteContext ctx) {
        Suite suite = new Suite();
        suite.line = ctx.getStart().getLine();
        for (var stmt : ctx.statement()) {
            suite.statementList.add((Statement) visit(stmt));
        }
        return suite;
    }

    @Override
    public ASTNode visitForLoop(LoopParser.ForLoopContext ctx) {
        ForLoop forLoop = new ForLoop();
        forLoop.line = ctx.getStart().getLine();
        var init = ctx.forInit();
        forLoop.typeName = init.typeName() == null ? null : init.typeName().getText();
        forLoop.varName = init.Identifier().getText();
        forLoop.initExp = (Expression) visit(init.expression());
        forLoop.conditionExp = (Expression) visit(ctx.expression(0));
        forLoop.stepExp = (Expression) visit(ctx.expression(1));
        forLoop.stmt = (Statement) visit(ctx.statement());
        return forLoop;
    }

    @Override
    public ASTNode visitSelectStatement(LoopParser.SelectStatementContext ctx) {
        SelectStatement select = new SelectStatement();
        select.line = ctx.getStart().getLine();
        select.judgeExp = (Expression) visit(ctx.expression());
        select.trueStmt = (Statement) visit(ctx.statement());
        return select;
    }

    @Override
    public ASTNode visitAtomExp(LoopParser.AtomExpContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public ASTNode visitArrayElementExp(LoopParser.ArrayElementExpContext ctx) {
        return new ArrayElementLhsExp((Expression) visit(ctx.expression(0)), (Expression) visit(ctx.expression(1)));
    }

    @Override
    public ASTNode visitPostfixExp(LoopParser.PostfixExpContext ctx) {
        return new PostfixExp((Expression) visit(ctx.expression()), ctx.op.getText());
    }

    @Override
    public ASTNode visitPrefixExp(LoopParser.PrefixExpContext ctx) {
        return new PrefixLhsExp(ctx.op.getText(), (Expression) visit(ctx.expression()));
    }

    @Override
    public ASTNode visitUnaryExp(LoopParser.UnaryExpContext ctx) {
        return new UnaryExp(ctx.op.getText(), (Expression) visit(ctx.expression()));
    }

    @Override
    public ASTNode visitBinaryExp(LoopParser.BinaryExpContext ctx) {
        return new BinaryExp((Expression) visit(ctx.expression(0)), ctx.op.getText(), (Expression) visit(ctx.expression(1)));
    }

    @Override
    public ASTNode visitTernaryExp(LoopParser.TernaryExpContext ctx) {
        return new TernaryExp((Expression) visit(ctx.expression(0)), (Expression) visit(ctx.expression(1)),
                (Expression) visit(ctx.expression(2)));
    }

    @Override
    public ASTNode visitAssignExp(LoopParser.AssignExpContext ctx) {
        return new AssignExp((Expression) visit(ctx.expression(0)), ctx.op.getText(), (Expression) visit(ctx.expression(1)));
    }

    @Override
    public ASTNode visitParenExp(LoopParser.ParenExpContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public ASTNode visitFunctionCallExp(LoopParser.FunctionCallExpContext ctx) {
        List<Expression> args = new ArrayList<>();
        for (var exp : ctx.expression()) {
            args.add((Expression) visit(exp));
        }
        return new FunctionCallLhsExp(ctx.Identifier().getText(), args);
    }

    @Override
    public ASTNode visitVariableExp(LoopParser.VariableExpContext ctx) {
        return new VariableLhsExp(ctx.Identifier().getText());
    }

    @Override
    public ASTNode visitNumberExp(LoopParser.NumberExpContext ctx) {
        return new NumberExp(ctx.IntLiteral().getText());
    }

    @Override
    public ASTNode visitFloatExp(LoopParser.FloatExpContext ctx) {
        return new FloatExp(ctx.FloatLiteral().getText());
    }
}
