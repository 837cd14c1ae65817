package polyopt.AST.statement;

import polyopt.AST.ASTNode;
import polyopt.AST.ASTVisitor;
import polyopt.AST.expression.Expression;
import polyopt.AST.statement.loopStatement.ForLoop;
import polyopt.AST.statement.selectStatement.SelectStatement;

// exactly one field is set; none for the empty statement
public class Statement extends ASTNode {
    public Suite suite;
    public ForLoop loopStatement;
    public SelectStatement selectStatement;
    public Expression exp;

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
