package polyopt.polyhedral.rebuild;

import polyopt.polyhedral.schedule.LoopType;

/**
 * {@code for (iterator = lower; iterator <= upper; iterator++) body}
 */
public class ForCode extends CodeNode {
    public final String iterator;
    public final LoopBound lower;
    public final LoopBound upper;
    public final LoopType type;
    public final CodeNode body;

    public ForCode(String iterator_, LoopBound lower_, LoopBound upper_, LoopType type_, CodeNode body_) {
        iterator = iterator_;
        lower = lower_;
        upper = upper_;
        type = type_;
        body = body_;
    }
}
