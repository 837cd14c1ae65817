package polyopt.polyhedral.affine;

import org.junit.jupiter.api.Test;
import polyopt.Util.error.ToolkitFailure;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BasicSetTest {
    private static BasicSet triangle() {
        return new BasicSet("S_0", List.of("i", "j"), List.of("N"), List.of(
                new Constrain(Affine.variable("j"), Constrain.GE),
                new Constrain(Affine.variable("i").addVarCo("j", -1), Constrain.GE),
                new Constrain(Affine.variable("N").addVarCo("i", -1).addBias(-1), Constrain.GE)));
    }

    @Test
    void enumeratesInLexicographicOrder() {
        List<long[]> points = triangle().enumerate(Map.of("N", 3L), 100);
        assertEquals(6, points.size());
        assertArrayEquals(new long[]{0, 0}, points.get(0));
        assertArrayEquals(new long[]{1, 0}, points.get(1));
        assertArrayEquals(new long[]{2, 2}, points.get(5));
        assertTrue(triangle().contains(new long[]{2, 1}, Map.of("N", 3L)));
    }

    @Test
    void enumerationHonorsStrides() {
        BasicSet strided = new BasicSet("S_0", List.of("i"), List.of(), List.of(
                new Constrain(Affine.variable("i").addBias(-1), Constrain.GE),
                new Constrain(Affine.variable("i").mul(-1).addBias(10), Constrain.GE),
                new Constrain(Affine.variable("i").addBias(-1), 3)));
        List<long[]> points = strided.enumerate(Map.of(), 100);
        assertEquals(4, points.size());
        assertArrayEquals(new long[]{10}, points.get(3));
    }

    @Test
    void emptyAndZeroDimensionalSets() {
        assertEquals(0, triangle().enumerate(Map.of("N", 0L), 100).size());
        BasicSet scalar = new BasicSet("S_1", List.of(), List.of("N"), List.of(
                new Constrain(Affine.variable("N").addBias(-5), Constrain.GE)));
        assertEquals(1, scalar.enumerate(Map.of("N", 5L), 100).size());
        assertEquals(0, scalar.enumerate(Map.of("N", 4L), 100).size());
    }

    @Test
    void failures() {
        assertThrows(ToolkitFailure.class, () -> triangle().enumerate(Map.of(), 100));
        assertThrows(ToolkitFailure.class, () -> triangle().enumerate(Map.of("N", 100L), 10));
        BasicSet unbounded = new BasicSet("S_0", List.of("i"), List.of(), List.of(
                new Constrain(Affine.variable("i"), Constrain.GE)));
        assertThrows(ToolkitFailure.class, () -> unbounded.enumerate(Map.of(), 100));
    }

    @Test
    void printsLikeIsl() {
        assertEquals("S_0[i, j] : j >= 0 and i - j >= 0 and -i + N - 1 >= 0", triangle().toString());
    }
}
