package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class PostfixExp extends Expression {
    public Expression exp;
    public String op;

    public PostfixExp(Expression exp_, String op_) {
        exp = exp_;
        op = op_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
