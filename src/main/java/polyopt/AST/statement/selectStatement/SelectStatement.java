package polyopt.AST.statement.selectStatement;

import polyopt.AST.ASTNode;
import polyopt.AST.ASTVisitor;
import polyopt.AST.expression.Expression;
import polyopt.AST.statement.Statement;

public class SelectStatement extends ASTNode {
    public Expression judgeExp;
    public Statement trueStmt;

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
