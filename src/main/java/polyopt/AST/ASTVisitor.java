package polyopt.AST;

import polyopt.AST.expression.*;
import polyopt.AST.statement.Statement;
import polyopt.AST.statement.Suite;
import polyopt.AST.statement.loopStatement.ForLoop;
import polyopt.AST.statement.selectStatement.SelectStatement;

public interface ASTVisitor {
    void visit(Program node);

    void visit(Statement node);

    void visit(Suite node);

    void visit(ForLoop node);

    void visit(SelectStatement node);

    void visit(NumberExp node);

    void visit(FloatExp node);

    void visit(VariableLhsExp node);

    void visit(ArrayElementLhsExp node);

    void visit(FunctionCallLhsExp node);

    void visit(BinaryExp node);

    void visit(UnaryExp node);

    void visit(PrefixLhsExp node);

    void visit(PostfixExp node);

    void visit(TernaryExp node);

    void visit(AssignExp node);
}
