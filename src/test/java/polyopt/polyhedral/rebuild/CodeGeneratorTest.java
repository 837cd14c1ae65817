package polyopt.polyhedral.rebuild;

import org.junit.jupiter.api.Test;
import polyopt.polyhedral.dependency.Dependency;
import polyopt.polyhedral.dependency.Model;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;
import polyopt.polyhedral.schedule.Instance;
import polyopt.polyhedral.schedule.ScheduleCursor;
import polyopt.polyhedral.schedule.ScheduleMap;
import polyopt.polyhedral.schedule.TimeVector;
import polyopt.polyhedral.transform.Fuse;
import polyopt.polyhedral.transform.Interchange;
import polyopt.polyhedral.transform.LoopHint;
import polyopt.polyhedral.transform.Scale;
import polyopt.polyhedral.transform.Shift;
import polyopt.polyhedral.transform.Tile;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CodeGeneratorTest {
    private Domain domain;

    private ScheduleCursor load(String body) {
        domain = new Domain(Extractor.parse(new ScopSource(0, body, 0, body.length(), 1, "")));
        return new ScheduleCursor(domain.schedule);
    }

    /**
     * The generated nest must run every instance once, in the order the
     * schedule dates them.
     */
    private void replay(ScheduleCursor cursor, Map<String, Long> params) {
        Model model = new Model(domain, params, EnumSet.allOf(Dependency.class), 100000);
        TimeVector[] times = new ScheduleMap(cursor.rootNode()).times(model.instances, params);
        List<Instance> sorted = new ArrayList<>(model.instances);
        sorted.sort((a, b) -> TimeVector.compare(times[a.id], times[b.id]));
        List<String> expected = new ArrayList<>();
        for (Instance instance : sorted) {
            expected.add(CodeInterpreter.key(instance.name, instance.point));
        }
        CodeNode code = new CodeGenerator(domain, "c").generate(cursor.rootNode());
        assertEquals(expected, CodeInterpreter.run(code, params));
    }

    @Test
    void originalScheduleOfATriangle() {
        ScheduleCursor root = load("""
                for (int i = 0; i < N; i++)
                  for (int j = 0; j <= i; j++)
                    A[i][j] = A[i][j] + B[j];
                """);
        replay(root, Map.of("N", 5L));
        replay(root, Map.of("N", 0L));
    }

    @Test
    void tiledLoop() {
        ScheduleCursor band = load("for (int i = 0; i < N; i++)\n  A[i] = A[i - 1] + 1;\n").child(0);
        replay(Tile.tile(band, 4), Map.of("N", 10L));
        replay(Tile.tile(band, 4), Map.of("N", 3L));
    }

    @Test
    void interchangedTriangle() {
        ScheduleCursor outer = load("""
                for (int i = 0; i < N; i++)
                  for (int j = 0; j <= i; j++)
                    A[i][j] = 0;
                """).child(0);
        replay(Interchange.interchange(outer), Map.of("N", 6L));
    }

    @Test
    void fusedAndScaled() {
        ScheduleCursor sequence = load("""
                for (int i = 0; i < N; i++)
                  A[i] = i;
                for (int i = 0; i < N; i++)
                  B[i] = A[i] + 1;
                """).child(0);
        ScheduleCursor band = Fuse.fuse(sequence, 0, 1).follow("0.0.0");
        replay(band, Map.of("N", 5L));
        replay(Scale.scale(band, 2), Map.of("N", 5L));
    }

    @Test
    void partialShiftSplitsTheBounds() {
        ScheduleCursor sequence = load("""
                for (int i = 0; i < N; i++)
                  A[i] = i;
                for (int i = 0; i < N; i++)
                  B[i] = A[i - 1];
                """).child(0);
        ScheduleCursor band = Fuse.fuse(sequence, 0, 1).follow("0.0.0");
        replay(Shift.partialShiftValue(band, 1, 1), Map.of("N", 6L));
        replay(Shift.partialShiftParam(band, 0, 1, 0), Map.of("N", 4L));
    }

    @Test
    void stridedAndDecreasingLoops() {
        replay(load("for (int i = 1; i <= N; i += 3)\n  A[i] = 0;\n"), Map.of("N", 11L));
        replay(load("for (int i = N - 1; i >= 0; i--)\n  A[i] = A[i + 1];\n"), Map.of("N", 5L));
        ScheduleCursor band = load("for (int i = 0; i < N; i += 2)\n  A[i] = 0;\n").child(0);
        replay(Tile.tile(band, 3), Map.of("N", 13L));
    }

    @Test
    void guardedStatements() {
        ScheduleCursor root = load("""
                for (int i = 0; i < N; i++) {
                  if (i >= 2 && 2 * i <= N)
                    A[i] = 0;
                  B[i] = 1;
                }
                """);
        replay(root, Map.of("N", 9L));
        replay(Shift.fullShiftValue(root.child(0), -1), Map.of("N", 9L));
    }

    @Test
    void printsAParallelLoop() {
        ScheduleCursor band = load("for (int i = 0; i < N; i++)\n  A[i] = A[i] + 1;\n").child(0);
        CodeNode code = new CodeGenerator(domain, "c").generate(LoopHint.setParallel(band).rootNode());
        assertEquals("  #pragma omp parallel for\n"
                + "  for (int c0 = 0; c0 <= N - 1; c0++)\n"
                + "    A[c0] = A[c0] + 1;\n", new CodePrinter("  ", 2).print(code));
    }

    @Test
    void printsMacrosOnlyWhenUsed() {
        ScheduleCursor band = load("for (int i = 0; i < N; i++)\n  A[i] = 0;\n").child(0);
        String text = new CodePrinter("", 4).print(new CodeGenerator(domain, "t").generate(Tile.tile(band, 4).rootNode()));
        assertTrue(text.startsWith("#define floord(n,d)"), text);
        assertTrue(text.contains("for (int t0 = 0; t0 <= floord(N - 1, 4); t0++)"), text);
        assertTrue(text.contains("A[t1] = 0;"), text);
    }

    @Test
    void statementsKeepTheirExpressions() {
        ScheduleCursor band = load("for (int i = 0; i < N; i++)\n  A[i] = f(B[i + 1], -x) * (y - z);\n").child(0);
        String text = new CodePrinter("", 2).print(new CodeGenerator(domain, "c").generate(Shift.fullShiftValue(band, 1).rootNode()));
        assertTrue(text.endsWith("  A[c0 - 1] = f(B[c0], -x) * (y - z);\n"), text);
    }
}
