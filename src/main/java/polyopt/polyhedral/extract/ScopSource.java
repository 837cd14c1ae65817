package polyopt.polyhedral.extract;

/**
 * Text of one {@code #pragma scop} region and where it sits in the source.
 * {@code start} and {@code end} are character offsets of the region body,
 * the pragma lines excluded.
 */
public class ScopSource {
    public final int index;
    public final String text;
    public final int start;
    public final int end;
    public final int firstLine;
    public final String indent;

    public ScopSource(int index_, String text_, int start_, int end_, int firstLine_, String indent_) {
        index = index_;
        text = text_;
        start = start_;
        end = end_;
        firstLine = firstLine_;
        indent = indent_;
    }
}
