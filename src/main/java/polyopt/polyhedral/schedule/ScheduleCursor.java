package polyopt.polyhedral.schedule;

import polyopt.Util.error.NavigationError;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.UnionSet;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A position in a schedule tree: the root plus the child indices leading from
 * it to the current node. Moving or editing returns a new cursor.
 */
public class ScheduleCursor {
    private final DomainNode root;
    private final int[] path;

    public ScheduleCursor(DomainNode root_) {
        this(root_, new int[0]);
    }

    private ScheduleCursor(DomainNode root_, int[] path_) {
        root = root_;
        path = path_;
    }

    public DomainNode rootNode() {
        return root;
    }

    public UnionSet domain() {
        return root.domain;
    }

    public int depth() {
        return path.length;
    }

    public int[] path() {
        return path.clone();
    }

    public ScheduleNode node() {
        ScheduleNode node = root;
        for (int pos : path) {
            node = node.child(pos);
        }
        return node;
    }

    public ScheduleNode ancestor(int level) {
        ScheduleNode node = root;
        for (int i = 0; i < level; ++i) {
            node = node.child(path[i]);
        }
        return node;
    }

    public ScheduleCursor root() {
        return new ScheduleCursor(root);
    }

    public ScheduleCursor parent() {
        if (path.length == 0) {
            throw new NavigationError("the root has no parent");
        }
        return new ScheduleCursor(root, Arrays.copyOf(path, path.length - 1));
    }

    public ScheduleCursor child(int pos) {
        int count = node().childCount();
        if (pos < 0 || pos >= count) {
            throw new NavigationError("child " + pos + " out of range, node has " + count + " children");
        }
        int[] next = Arrays.copyOf(path, path.length + 1);
        next[path.length] = pos;
        return new ScheduleCursor(root, next);
    }

    /**
     * Follows {@code path} from the root, e.g. {@code "0.1.0"}; an empty path or
     * {@code "-"} is the root itself.
     */
    public ScheduleCursor follow(String pathText) {
        ScheduleCursor cursor = root();
        String text = pathText.trim();
        if (text.isEmpty() || text.equals("-")) {
            return cursor;
        }
        for (String part : text.split("\\.")) {
            try {
                cursor = cursor.child(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw new NavigationError("bad path component " + part + " in " + pathText);
            }
        }
        return cursor;
    }

    /**
     * Same path, with the node at the cursor replaced and its ancestors rebuilt.
     */
    public ScheduleCursor replace(ScheduleNode node) {
        ScheduleNode rebuilt = node;
        for (int level = path.length - 1; level >= 0; --level) {
            rebuilt = ancestor(level).withChild(path[level], rebuilt);
        }
        if (!(rebuilt instanceof DomainNode domainNode)) {
            throw new ToolkitFailure("the root of a schedule tree must be a domain node");
        }
        return new ScheduleCursor(domainNode, path);
    }

    /**
     * Statements whose instances reach the current node.
     */
    public Set<String> activeStatements() {
        Set<String> result = new LinkedHashSet<>(root.domain.names());
        ScheduleNode node = root;
        for (int pos : path) {
            if (node instanceof FilterNode filter) {
                result.retainAll(filter.statements);
            }
            node = node.child(pos);
        }
        if (node instanceof FilterNode filter) {
            result.retainAll(filter.statements);
        }
        return result;
    }

    public String pathText() {
        if (path.length == 0) {
            return "-";
        }
        StringBuilder sb = new StringBuilder();
        for (int pos : path) {
            if (sb.length() != 0) {
                sb.append('.');
            }
            sb.append(pos);
        }
        return sb.toString();
    }
}
