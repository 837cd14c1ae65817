package polyopt.polyhedral.schedule;

import java.util.List;

/**
 * Children in no particular order. Every child is a {@link FilterNode}.
 */
public class SetNode extends ScheduleNode {
    public final List<ScheduleNode> children;

    public SetNode(List<ScheduleNode> children_) {
        children = List.copyOf(children_);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SET;
    }

    @Override
    public List<ScheduleNode> children() {
        return children;
    }

    @Override
    public ScheduleNode withChildren(List<ScheduleNode> children) {
        return new SetNode(children);
    }
}
