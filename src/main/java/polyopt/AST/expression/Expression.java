package polyopt.AST.expression;

import polyopt.AST.ASTNode;

public abstract class Expression extends ASTNode {
}
