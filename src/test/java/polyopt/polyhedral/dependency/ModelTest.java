package polyopt.polyhedral.dependency;

import org.junit.jupiter.api.Test;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelTest {
    private static Model model(String body, Map<String, Long> params, EnumSet<Dependency> kinds) {
        Domain domain = new Domain(Extractor.parse(new ScopSource(0, body, 0, body.length(), 1, "")));
        return new Model(domain, params, kinds, 10000);
    }

    @Test
    void recurrenceHasAChainOfFlowDependences() {
        Model model = model("for (int i = 0; i < N; i++)\n  A[i] = A[i - 1] + 1;\n",
                Map.of("N", 4L), EnumSet.allOf(Dependency.class));
        assertEquals(4, model.instances.size());
        assertArrayEquals(new long[]{2}, model.instances.get(2).point);
        DependenceRelation dependences = model.dependences;
        assertEquals(3, dependences.size());
        assertEquals(3, dependences.count(Dependency.FLOW));
        assertEquals(0, dependences.count(Dependency.ANTI));
        assertTrue(dependences.contains(0, 1));
        assertTrue(dependences.contains(2, 3));
        assertFalse(dependences.contains(0, 2));
    }

    @Test
    void scalarCarriesEveryKind() {
        String body = """
                for (int i = 0; i < N; i++) {
                  x = A[i];
                  B[i] = x;
                }
                """;
        Model model = model(body, Map.of("N", 3L), EnumSet.allOf(Dependency.class));
        assertEquals("S_0", model.instances.get(0).name);
        assertEquals("S_1", model.instances.get(1).name);
        assertEquals("S_0", model.instances.get(2).name);
        DependenceRelation dependences = model.dependences;
        assertEquals(3, dependences.count(Dependency.FLOW));
        assertEquals(2, dependences.count(Dependency.ANTI));
        assertEquals(2, dependences.count(Dependency.OUTPUT));
        assertTrue(dependences.contains(1, 2));
        assertTrue(dependences.contains(0, 2));
        assertEquals("7 dependences (flow 3, anti 2, output 2)", dependences.toString());
    }

    @Test
    void flowOnlyKeepsEveryEarlierWrite() {
        String body = """
                for (int i = 0; i < N; i++) {
                  x = A[i];
                  B[i] = x;
                }
                """;
        Model model = model(body, Map.of("N", 3L), EnumSet.of(Dependency.FLOW));
        assertEquals(6, model.dependences.size());
        assertTrue(model.dependences.contains(0, 5));
        assertEquals(0, model.dependences.count(Dependency.OUTPUT));
    }

    @Test
    void valuesBindIteratorsAndParameters() {
        Model model = model("for (int i = 0; i < N; i++)\n  for (int j = i; j < N; j++)\n    A[i][j] = 0;\n",
                Map.of("N", 3L), EnumSet.allOf(Dependency.class));
        assertEquals(6, model.instances.size());
        assertEquals(Map.of("N", 3L, "i", 1L, "j", 2L), model.values(model.instances.get(4)));
        assertTrue(model.dependences.isEmpty());
    }

    @Test
    void releaseDropsThePairs() {
        Model model = model("for (int i = 0; i < N; i++)\n  A[i] = A[i - 1];\n", Map.of("N", 3L), EnumSet.allOf(Dependency.class));
        model.dependences.release();
        assertTrue(model.dependences.released());
        assertEquals(0, model.dependences.size());
    }

    @Test
    void instanceLimit() {
        assertThrows(ToolkitFailure.class, () -> model("for (int i = 0; i < N; i++)\n  A[i] = 0;\n",
                Map.of("N", 20000L), EnumSet.allOf(Dependency.class)));
    }
}
