package polyopt.polyhedral.schedule;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class FilterNode extends ScheduleNode {
    public final Set<String> statements;
    public final ScheduleNode child;

    public FilterNode(Collection<String> statements_, ScheduleNode child_) {
        statements = Collections.unmodifiableSet(new LinkedHashSet<>(statements_));
        child = child_;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILTER;
    }

    @Override
    public List<ScheduleNode> children() {
        return List.of(child);
    }

    @Override
    public ScheduleNode withChildren(List<ScheduleNode> children) {
        return new FilterNode(statements, children.get(0));
    }
}
