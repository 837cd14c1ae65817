package polyopt.AST;

import polyopt.AST.statement.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Statements of one scop region.
 */
public class Program extends ASTNode {
    public List<Statement> statementList;

    public Program() {
        statementList = new ArrayList<>();
    }

    @Override
    public void accept(ASTVisitor visitor) {
        visitor.visit(this);
    }
}
