package polyopt.Util.error;

/**
 * An operator was applied where it does not make sense (wrong node kind, bad
 * argument). The transaction that ran the operator is abandoned.
 */
public class OperatorPrecondition extends Errors {
    public OperatorPrecondition(String message) {
        super("OperatorPrecondition", message);
    }
}
