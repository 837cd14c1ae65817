package polyopt.Util.error;

/**
 * Cursor movement that has no target: parent of the root, or a child index
 * outside {@code [0, childCount)}. The cursor is left where it was.
 */
public class NavigationError extends Errors {
    public NavigationError(String message) {
        super("NavigationError", message);
    }
}
