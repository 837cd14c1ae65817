package polyopt.polyhedral.rebuild;

import java.util.List;

public class BlockCode extends CodeNode {
    public final List<CodeNode> children;

    public BlockCode(List<CodeNode> children_) {
        children = children_;
    }
}
