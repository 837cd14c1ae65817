package polyopt.Util.error;

/**
 * Malformed input or inconsistent polyhedral data. Fatal to the scop that
 * raised it, never to the whole session.
 */
public class ToolkitFailure extends Errors {
    public ToolkitFailure(String message) {
        super("ToolkitFailure", message);
    }

    public ToolkitFailure(String message, Throwable cause) {
        super("ToolkitFailure", message, cause);
    }
}
