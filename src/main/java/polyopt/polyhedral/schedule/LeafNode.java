package polyopt.polyhedral.schedule;

import java.util.List;

public class LeafNode extends ScheduleNode {
    @Override
    public NodeKind kind() {
        return NodeKind.LEAF;
    }

    @Override
    public List<ScheduleNode> children() {
        return List.of();
    }

    @Override
    public ScheduleNode withChildren(List<ScheduleNode> children) {
        return this;
    }
}
