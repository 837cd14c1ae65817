package polyopt.polyhedral.rebuild;

/**
 * Node of the generated loop nest.
 */
public abstract class CodeNode {
}
