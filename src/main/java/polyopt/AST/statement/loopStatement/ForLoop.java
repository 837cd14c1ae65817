package polyopt.AST.statement.loopStatement;

import polyopt.AST.ASTNode;
import polyopt.AST.ASTVisitor;
import polyopt.AST.expression.Expression;
import polyopt.AST.statement.Statement;

public class ForLoop extends ASTNode {
    public String varName;
    public String typeName;
    public Expression initExp;
    public Expression conditionExp;
    public Expression stepExp;
    public Statement stmt;

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
