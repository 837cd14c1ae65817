package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class FloatExp extends Expression {
    public String text;

    public FloatExp(String text_) {
        text = text_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
