package polyopt.polyhedral.matrix;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatrixTest {
    @Test
    void fractionsStayReduced() {
        assertEquals(new Fraction(-1, 2), new Fraction(3, -6));
        assertEquals("0", new Fraction(0, -5).toString());
        assertEquals("5/6", new Fraction(1, 2).add(new Fraction(1, 3)).toString());
        assertEquals(new Fraction(1, 6), new Fraction(1, 2).sub(new Fraction(1, 3)));
        assertEquals(new Fraction(3, 2), new Fraction(1, 2).div(new Fraction(1, 3)));
        assertTrue(new Fraction(4, 2).isInteger());
        assertEquals(2, new Fraction(4, 2).toLong());
        assertFalse(new Fraction(1, 2).equal(0));
        assertThrows(ArithmeticException.class, () -> new Fraction(1, 2).toLong());
        assertThrows(ArithmeticException.class, () -> new Fraction(1, 0));
        assertThrows(ArithmeticException.class, () -> new Fraction(1).div(new Fraction(0)));
        assertEquals(12, Fraction.getDenominatorLCM(4, 6));
    }

    @Test
    void reduceSolvesForThePivots() {
        // x + y = 3, x - y = 1
        Matrix matrix = new Matrix(2, 3);
        long[][] rows = {{1, 1, 3}, {1, -1, 1}};
        for (int r = 0; r < 2; ++r) {
            for (int c = 0; c < 3; ++c) {
                matrix.setElement(r, c, new Fraction(rows[r][c]));
            }
        }
        assertEquals(List.of(0, 1), matrix.reduce(2));
        assertEquals(new Fraction(2), matrix.getElement(0, 2));
        assertEquals(new Fraction(1), matrix.getElement(1, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.getElement(2, 0));
    }

    @Test
    void dependentColumnsGetNoPivot() {
        Matrix matrix = new Matrix(2, 3);
        matrix.setElement(0, 0, new Fraction(2));
        matrix.setElement(0, 1, new Fraction(4));
        matrix.setElement(1, 0, new Fraction(1));
        matrix.setElement(1, 1, new Fraction(2));
        assertEquals(List.of(0), matrix.reduce(2));
        assertEquals(new Fraction(2), matrix.getElement(0, 1));
        assertTrue(matrix.getElement(1, 1).equal(0));
    }
}
