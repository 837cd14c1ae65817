package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

public class VariableLhsExp extends Expression {
    public String variableName;

    public VariableLhsExp(String variableName_) {
        variableName = variableName_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
