package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.affine.QuasiAffine;
import polyopt.polyhedral.affine.UnionPwAff;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.ScheduleCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Shifts of a one-dimensional band. The correction is built piece by piece,
 * zero on the pieces that are not targeted, and added to the dimension; the
 * tuple id and the dimension count are kept.
 */
public class Shift {
    public static ScheduleCursor fullShiftValue(ScheduleCursor cursor, long value) {
        BandNode band = Bands.singleDimBand(cursor, "shift");
        return apply(cursor, band, -1, piece -> QuasiAffine.constant(value));
    }

    public static ScheduleCursor fullShiftVariable(ScheduleCursor cursor, long coefficient, int var) {
        BandNode band = Bands.singleDimBand(cursor, "shift");
        return apply(cursor, band, -1, piece -> iterator(piece, coefficient, var));
    }

    public static ScheduleCursor fullShiftParam(ScheduleCursor cursor, long coefficient, int param) {
        BandNode band = Bands.singleDimBand(cursor, "shift");
        String name = parameter(band, param);
        return apply(cursor, band, -1, piece -> QuasiAffine.variable(name).mul(coefficient));
    }

    public static ScheduleCursor partialShiftValue(ScheduleCursor cursor, int stmt, long value) {
        BandNode band = Bands.singleDimBand(cursor, "shift");
        return apply(cursor, band, stmt, piece -> QuasiAffine.constant(value));
    }

    public static ScheduleCursor partialShiftVariable(ScheduleCursor cursor, int stmt, long coefficient, int var) {
        BandNode band = Bands.singleDimBand(cursor, "shift");
        return apply(cursor, band, stmt, piece -> iterator(piece, coefficient, var));
    }

    public static ScheduleCursor partialShiftParam(ScheduleCursor cursor, int stmt, long coefficient, int param) {
        BandNode band = Bands.singleDimBand(cursor, "shift");
        String name = parameter(band, param);
        return apply(cursor, band, stmt, piece -> QuasiAffine.variable(name).mul(coefficient));
    }

    private static QuasiAffine iterator(UnionPwAff.Piece piece, long coefficient, int var) {
        if (var < 0 || var >= piece.dims.size()) {
            throw new OperatorPrecondition("iterator " + var + " out of range for " + piece.name + " with "
                    + piece.dims.size() + " iterators");
        }
        return QuasiAffine.variable(piece.dims.get(var)).mul(coefficient);
    }

    private static String parameter(BandNode band, int param) {
        List<String> params = band.schedule.params;
        if (param < 0 || param >= params.size()) {
            throw new OperatorPrecondition("parameter " + param + " out of range, the scop has " + params.size());
        }
        return params.get(param);
    }

    // stmt < 0 targets every piece
    private static ScheduleCursor apply(ScheduleCursor cursor, BandNode band, int stmt,
                                        Function<UnionPwAff.Piece, QuasiAffine> correction) {
        UnionPwAff dim = band.schedule.get(0);
        List<UnionPwAff.Piece> pieces = dim.pieceList();
        if (stmt >= pieces.size() || (stmt < 0 && stmt != -1)) {
            throw new OperatorPrecondition("statement " + stmt + " out of range, the band has " + pieces.size() + " pieces");
        }
        List<UnionPwAff.Piece> shifted = new ArrayList<>();
        for (int i = 0; i < pieces.size(); ++i) {
            var piece = pieces.get(i);
            QuasiAffine value = stmt == -1 || stmt == i ? correction.apply(piece) : QuasiAffine.constant(0);
            shifted.add(piece.withExpr(value));
        }
        UnionPwAff shift = new UnionPwAff(shifted);
        return cursor.replace(band.withSchedule(band.schedule.withDims(List.of(dim.add(shift)))));
    }
}
