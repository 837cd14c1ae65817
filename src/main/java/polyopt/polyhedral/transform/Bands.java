package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.ScheduleCursor;

class Bands {
    static BandNode band(ScheduleCursor cursor, String operator) {
        if (!(cursor.node() instanceof BandNode band)) {
            throw new OperatorPrecondition(operator + " needs a band node, found " + cursor.node().kind());
        }
        return band;
    }

    static BandNode singleDimBand(ScheduleCursor cursor, String operator) {
        BandNode band = band(cursor, operator);
        if (band.dims() != 1) {
            throw new OperatorPrecondition(operator + " needs a one-dimensional band, found " + band.dims() + " dimensions");
        }
        return band;
    }
}
