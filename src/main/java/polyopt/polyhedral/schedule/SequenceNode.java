package polyopt.polyhedral.schedule;

import java.util.List;

/**
 * Children run one after the other. Every child is a {@link FilterNode}.
 */
public class SequenceNode extends ScheduleNode {
    public final List<ScheduleNode> children;

    public SequenceNode(List<ScheduleNode> children_) {
        children = List.copyOf(children_);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEQUENCE;
    }

    @Override
    public List<ScheduleNode> children() {
        return children;
    }

    @Override
    public ScheduleNode withChildren(List<ScheduleNode> children) {
        return new SequenceNode(children);
    }
}
