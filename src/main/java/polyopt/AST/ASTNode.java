package polyopt.AST;

public abstract class ASTNode {
    public int line;

    public abstract void accept(ASTVisitor visitor);
}
