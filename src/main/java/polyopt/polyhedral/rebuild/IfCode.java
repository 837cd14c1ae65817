package polyopt.polyhedral.rebuild;

import polyopt.polyhedral.affine.Constrain;

import java.util.List;

/**
 * Conjunction of conditions guarding {@code body}.
 */
public class IfCode extends CodeNode {
    public final List<Constrain> conditions;
    public final CodeNode body;

    public IfCode(List<Constrain> conditions_, CodeNode body_) {
        conditions = conditions_;
        body = body_;
    }
}
