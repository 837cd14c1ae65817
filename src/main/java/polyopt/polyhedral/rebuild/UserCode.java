package polyopt.polyhedral.rebuild;

import polyopt.polyhedral.affine.AffineFraction;
import polyopt.polyhedral.extract.Assign;

import java.util.Map;

/**
 * One execution of a statement; {@code values} gives each of its iterators
 * as a function of the enclosing loop iterators and the parameters.
 */
public class UserCode extends CodeNode {
    public final Assign stmt;
    public final Map<String, AffineFraction> values;

    public UserCode(Assign stmt_, Map<String, AffineFraction> values_) {
        stmt = stmt_;
        values = values_;
    }
}
