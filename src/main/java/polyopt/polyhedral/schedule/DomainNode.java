package polyopt.polyhedral.schedule;

import polyopt.polyhedral.affine.UnionSet;

import java.util.List;

public class DomainNode extends ScheduleNode {
    public final UnionSet domain;
    public final ScheduleNode child;

    public DomainNode(UnionSet domain_, ScheduleNode child_) {
        domain = domain_;
        child = child_;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DOMAIN;
    }

    @Override
    public List<ScheduleNode> children() {
        return List.of(child);
    }

    @Override
    public ScheduleNode withChildren(List<ScheduleNode> children) {
        return new DomainNode(domain, children.get(0));
    }
}
