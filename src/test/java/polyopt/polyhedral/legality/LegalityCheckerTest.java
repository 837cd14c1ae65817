package polyopt.polyhedral.legality;

import org.junit.jupiter.api.Test;
import polyopt.polyhedral.dependency.Dependency;
import polyopt.polyhedral.dependency.Model;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;
import polyopt.polyhedral.schedule.ScheduleCursor;
import polyopt.polyhedral.schedule.SequenceNode;
import polyopt.polyhedral.schedule.SetNode;
import polyopt.polyhedral.transform.Fuse;
import polyopt.polyhedral.transform.Interchange;
import polyopt.polyhedral.transform.Scale;
import polyopt.polyhedral.transform.Shift;
import polyopt.polyhedral.transform.Tile;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LegalityCheckerTest {
    private Model model;
    private LegalityChecker checker;

    private ScheduleCursor load(String body, long n) {
        Domain domain = new Domain(Extractor.parse(new ScopSource(0, body, 0, body.length(), 1, "")));
        model = new Model(domain, Map.of("N", n), EnumSet.allOf(Dependency.class), 100000);
        checker = new LegalityChecker(model.instances, model.params, model.dependences);
        return new ScheduleCursor(domain.schedule);
    }

    @Test
    void reversingARecurrenceIsIllegal() {
        ScheduleCursor band = load("for (int i = 0; i < N; i++)\n  A[i] = A[i - 1] + 1;\n", 6).child(0);
        assertTrue(checker.isLegal(band.rootNode()));
        assertFalse(checker.isLegal(Scale.scale(band, -1).rootNode()));
        assertTrue(checker.isLegal(Scale.scale(band, 3).rootNode()));
        assertTrue(checker.isLegal(Shift.fullShiftValue(band, 5).rootNode()));
        assertTrue(checker.isLegal(Tile.tile(band, 4).rootNode()));
        assertFalse(checker.isParallel(band));
    }

    @Test
    void independentIterationsAreParallel() {
        ScheduleCursor band = load("for (int i = 0; i < N; i++)\n  A[i] = B[i] + 1;\n", 6).child(0);
        assertTrue(checker.isParallel(band));
        assertTrue(checker.isLegal(Scale.scale(band, -1).rootNode()));
    }

    @Test
    void innerLoopOfAColumnSweepIsParallel() {
        ScheduleCursor outer = load("""
                for (int i = 1; i < N; i++)
                  for (int j = 0; j < N; j++)
                    A[i][j] = A[i - 1][j] * 2;
                """, 5).child(0);
        assertFalse(checker.isParallel(outer));
        assertTrue(checker.isParallel(outer.child(0)));
        ScheduleCursor swapped = Interchange.interchange(outer);
        assertTrue(checker.isLegal(swapped.rootNode()));
        assertTrue(checker.isParallel(swapped));
        assertFalse(checker.isParallel(swapped.child(0)));
    }

    @Test
    void fusionKeepsProducerFirst() {
        ScheduleCursor sequence = load("""
                for (int i = 0; i < N; i++)
                  A[i] = i;
                for (int i = 0; i < N; i++)
                  B[i] = A[i] + 1;
                """, 4).child(0);
        ScheduleCursor fused = Fuse.fuse(sequence, 0, 1);
        assertTrue(checker.isLegal(fused.rootNode()));

        ScheduleCursor inner = fused.follow("0.0.0.0");
        SequenceNode order = (SequenceNode) inner.node();
        ScheduleCursor swapped = inner.replace(new SequenceNode(List.of(order.children.get(1), order.children.get(0))));
        assertFalse(checker.isLegal(swapped.rootNode()));

        ScheduleCursor unordered = inner.replace(new SetNode(order.children));
        assertFalse(checker.isLegal(unordered.rootNode()));
    }

    @Test
    void fusionAgainstAReverseReadIsIllegal() {
        ScheduleCursor sequence = load("""
                for (int i = 0; i < N; i++)
                  A[i] = i;
                for (int i = 0; i < N; i++)
                  B[i] = A[N - 1 - i];
                """, 4).child(0);
        assertFalse(checker.isLegal(Fuse.fuse(sequence, 0, 1).rootNode()));
    }
}
