package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class TernaryExp extends Expression {
    public Expression condition;
    public Expression trueExp;
    public Expression falseExp;

    public TernaryExp(Expression condition_, Expression trueExp_, Expression falseExp_) {
        condition = condition_;
        trueExp = trueExp_;
        falseExp = falseExp_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
