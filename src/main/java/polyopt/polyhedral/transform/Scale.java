package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.ScheduleCursor;

public class Scale {
    public static ScheduleCursor scale(ScheduleCursor cursor, long factor) {
        BandNode band = Bands.band(cursor, "scale");
        if (factor == 0) {
            throw new OperatorPrecondition("scale factor must not be zero");
        }
        return cursor.replace(band.withSchedule(band.schedule.map(dim -> dim.map(piece -> piece.expr.mul(factor)))));
    }
}
