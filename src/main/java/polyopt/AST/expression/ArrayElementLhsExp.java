package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class ArrayElementLhsExp extends Expression {
    public Expression variable;
    public Expression index;

    public ArrayElementLhsExp(Expression variable_, Expression index_) {
        variable = variable_;
        index = index_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
