package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.affine.MultiUnionPwAff;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.ScheduleCursor;

public class Tile {
    /**
     * Splits every dimension {@code f} of the band into a tile loop
     * {@code floor(f / size)} and a point loop {@code f}. The cursor stays on
     * the tile band.
     */
    public static ScheduleCursor tile(ScheduleCursor cursor, long size) {
        BandNode band = Bands.band(cursor, "tile");
        if (size <= 0) {
            throw new OperatorPrecondition("tile size must be positive, got " + size);
        }
        MultiUnionPwAff outer = band.schedule.map(dim -> dim.map(piece -> piece.expr.floorDiv(size)));
        BandNode point = new BandNode(band.schedule, band.loopTypes, band.child);
        return cursor.replace(new BandNode(outer, point));
    }
}
