package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class NumberExp extends Expression {
    public long value;
    public String text;

    public NumberExp(String text_) {
        text = text_;
        value = Long.parseLong(text_.replaceAll("[uUlL]+$", ""));
    }

    public NumberExp(long value_) {
        value = value_;
        text = Long.toString(value_);
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
