package polyopt.polyhedral.schedule;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable schedule tree node. Edits build new nodes and share the
 * untouched subtrees.
 */
public abstract class ScheduleNode {
    public abstract NodeKind kind();

    public abstract List<ScheduleNode> children();

    public abstract ScheduleNode withChildren(List<ScheduleNode> children);

    public int childCount() {
        return children().size();
    }

    public ScheduleNode child(int pos) {
        return children().get(pos);
    }

    public ScheduleNode withChild(int pos, ScheduleNode child) {
        List<ScheduleNode> list = new ArrayList<>(children());
        list.set(pos, child);
        return withChildren(list);
    }
}
