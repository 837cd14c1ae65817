package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class BinaryExp extends Expression {
    public Expression lhs;
    public Expression rhs;
    public String op;

    public BinaryExp(Expression lhs_, String op_, Expression rhs_) {
        lhs = lhs_;
        op = op_;
        rhs = rhs_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
