package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.LoopType;
import polyopt.polyhedral.schedule.ScheduleCursor;

public class LoopHint {
    public static ScheduleCursor setParallel(ScheduleCursor cursor) {
        BandNode band = Bands.band(cursor, "parallel");
        return cursor.replace(band.withLoopType(0, LoopType.PARALLEL));
    }

    public static ScheduleCursor setLoopOpt(ScheduleCursor cursor, int pos, LoopType type) {
        BandNode band = Bands.band(cursor, "loop option");
        if (pos < 0 || pos >= band.dims()) {
            throw new OperatorPrecondition("dimension " + pos + " out of range, the band has " + band.dims());
        }
        return cursor.replace(band.withLoopType(pos, type));
    }
}
