package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class UnaryExp extends Expression {
    public Expression exp;
    public String op;

    public UnaryExp(String op_, Expression exp_) {
        op = op_;
        exp = exp_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
