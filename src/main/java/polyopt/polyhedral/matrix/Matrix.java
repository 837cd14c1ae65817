package polyopt.polyhedral.matrix;

import java.util.ArrayList;
import java.util.List;

public class Matrix {
    private final Fraction[][] data;
    private final int rows;
    private final int columns;

    public Matrix(int rows, int columns) {
        this.rows = rows;
        this.columns = columns;
        this.data = new Fraction[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                data[i][j] = new Fraction(0);
            }
        }
    }

    public void setElement(int row, int column, Fraction value) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Element (" + row + ", " + column + ") out of bounds.");
        }
        data[row][column] = value;
    }

    public Fraction getElement(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Element (" + row + ", " + column + ") out of bounds.");
        }
        return data[row][column];
    }

    public int row() {
        return rows;
    }

    public int column() {
        return columns;
    }

    /**
     * Gauss-Jordan elimination in place over the first {@code pivotColumns}
     * columns; the remaining columns are carried along as right-hand sides.
     * Returns, for each pivot row in order, the column of its pivot.
     */
    public List<Integer> reduce(int pivotColumns) {
        List<Integer> pivots = new ArrayList<>();
        int row = 0;
        for (int col = 0; col < pivotColumns && row < rows; col++) {
            int select = -1;
            for (int trow = row; trow < rows; trow++) {
                if (!data[trow][col].equal(0)) {
                    select = trow;
                    break;
                }
            }
            if (select == -1) {
                continue;
            }
            Fraction[] temp = data[row];
            data[row] = data[select];
            data[select] = temp;
            Fraction pivot = data[row][col];
            for (int c = 0; c < columns; c++) {
                data[row][c] = data[row][c].div(pivot);
            }
            for (int trow = 0; trow < rows; trow++) {
                if (trow == row || data[trow][col].equal(0)) {
                    continue;
                }
                Fraction k = data[trow][col];
                for (int c = 0; c < columns; c++) {
                    data[trow][c] = data[trow][c].sub(k.mul(data[row][c]));
                }
            }
            pivots.add(col);
            ++row;
        }
        return pivots;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                sb.append(data[i][j]).append("\t");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
