package polyopt.polyhedral.schedule;

import org.junit.jupiter.api.Test;
import polyopt.Util.error.NavigationError;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScheduleTreeTest {
    private static final String twoLoops = """
            for (int i = 0; i < N; i++)
              A[i] = i;
            for (int i = 0; i < N; i++)
              for (int j = 0; j < M; j++)
                B[i][j] = A[i] * 2;
            """;

    static Domain domain(String body) {
        return new Domain(Extractor.parse(new ScopSource(0, body, 0, body.length(), 1, "")));
    }

    private static String print(DomainNode root) {
        return new ScheduleTreePrinter(root.domain).print(root);
    }

    @Test
    void printsOneLoop() {
        Domain domain = domain("for (int i = 0; i < N; i++)\n  A[i] = 0;\n");
        assertEquals("{ domain: \"[N] -> { S_0[i] : i >= 0 and -i + N - 1 >= 0 }\", "
                + "child: { schedule: \"[N] -> L_0[{ S_0[i] -> [(i)] }]\" } }", print(domain.schedule));
    }

    @Test
    void readsWhatItPrints() {
        Domain domain = domain(twoLoops);
        String text = print(domain.schedule);
        DomainNode copy = new ScheduleTreeReader().read(text);
        assertEquals(text, print(copy));
        DomainNode renamed = new ScheduleTreeReader().read(text, domain.domain);
        assertSame(domain.domain, renamed.domain);
        assertEquals(text, print(renamed));
    }

    @Test
    void readsLoopTypes() {
        Domain domain = domain("for (int i = 0; i < N; i++)\n  A[i] = 0;\n");
        ScheduleCursor cursor = new ScheduleCursor(domain.schedule).child(0);
        BandNode band = ((BandNode) cursor.node()).withLoopType(0, LoopType.PARALLEL);
        DomainNode root = cursor.replace(band).rootNode();
        String text = print(root);
        assertEquals(text, print(new ScheduleTreeReader().read(text)));
        BandNode read = (BandNode) new ScheduleTreeReader().read(text).child;
        assertEquals(LoopType.PARALLEL, read.loopTypes.get(0));
    }

    @Test
    void rejectsMalformedTrees() {
        ScheduleTreeReader reader = new ScheduleTreeReader();
        String domain = "domain: \"[N] -> { S_0[i] : i >= 0 and -i + N - 1 >= 0 }\"";
        assertThrows(ToolkitFailure.class, () -> reader.read("{ " + domain));
        assertThrows(ToolkitFailure.class, () -> reader.read("{ schedule: \"[N] -> L_0[{ S_0[i] -> [(i)] }]\" }"));
        assertThrows(ToolkitFailure.class, () -> reader.read("{ " + domain + ", child: { schedule: \"[N] -> L_0[{ S_1[i] -> [(i)] }]\" } }"));
        assertThrows(ToolkitFailure.class, () -> reader.read("{ " + domain + ", child: { schedule: \"[N] -> L_0[{ S_0[i] -> [(k)] }]\" } }"));
        assertThrows(ToolkitFailure.class, () -> reader.read("{ " + domain + ", " + domain + " }"));
        Domain other = domain(twoLoops);
        String text = "{ " + domain + " }";
        assertThrows(ToolkitFailure.class, () -> reader.read(text, other.domain));
    }

    @Test
    void sequenceMustCoverEveryStatement() {
        Domain domain = domain(twoLoops);
        SequenceNode sequence = (SequenceNode) domain.schedule.child;
        DomainNode broken = new DomainNode(domain.domain, new SequenceNode(sequence.children.subList(0, 1)));
        assertThrows(ToolkitFailure.class, () -> ScheduleValidator.validate(broken));
        ScheduleValidator.validate(domain.schedule);
    }

    @Test
    void cursorNavigation() {
        ScheduleCursor root = new ScheduleCursor(domain(twoLoops).schedule);
        assertThrows(NavigationError.class, root::parent);
        assertThrows(NavigationError.class, () -> root.child(1));
        ScheduleCursor inner = root.follow("0.1.0.0");
        assertEquals(NodeKind.BAND, inner.node().kind());
        assertEquals("0.1.0.0", inner.pathText());
        assertArrayEquals(new int[]{0, 1, 0, 0}, inner.path());
        assertEquals(Set.of("S_1"), inner.activeStatements());
        assertEquals(NodeKind.FILTER, inner.parent().parent().node().kind());
        assertEquals("-", inner.root().pathText());
        assertThrows(NavigationError.class, () -> root.follow("0.x"));
        assertThrows(NavigationError.class, () -> inner.child(0).child(0));
        assertEquals(4, inner.depth());
    }

    @Test
    void replaceRebuildsAncestors() {
        DomainNode original = domain(twoLoops).schedule;
        ScheduleCursor cursor = new ScheduleCursor(original).follow("0.0.0");
        BandNode band = (BandNode) cursor.node();
        ScheduleCursor edited = cursor.replace(band.withLoopType(0, LoopType.UNROLL));
        assertEquals("0.0.0", edited.pathText());
        assertEquals(LoopType.UNROLL, ((BandNode) edited.node()).loopTypes.get(0));
        assertEquals(LoopType.DEFAULT, ((BandNode) cursor.node()).loopTypes.get(0));
        assertSame(original.domain, edited.domain());
    }
}
