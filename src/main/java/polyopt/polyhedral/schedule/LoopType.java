package polyopt.polyhedral.schedule;

import polyopt.Util.error.ToolkitFailure;

import java.util.Locale;

/**
 * Code generation hint attached to one band dimension.
 */
public enum LoopType {
    DEFAULT, ATOMIC, UNROLL, SEPARATE, PARALLEL;

    public String text() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LoopType parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ToolkitFailure("unknown loop type " + text, e);
        }
    }
}
