package polyopt.AST.expression;

import polyopt.AST.ASTVisitor;

import java.util.List;

public class FunctionCallLhsExp extends Expression {
    public String functionName;
    public List<Expression> callExpList;

    public FunctionCallLhsExp(String functionName_, List<Expression> callExpList_) {
        functionName = functionName_;
        callExpList = callExpList_;
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
