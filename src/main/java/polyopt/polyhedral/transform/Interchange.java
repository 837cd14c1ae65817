package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.ScheduleCursor;

public class Interchange {
    /**
     * Swaps a band with the band that is its only child. The cursor ends on
     * the upper band, which now holds the former child's schedule.
     */
    public static ScheduleCursor interchange(ScheduleCursor cursor) {
        BandNode band = Bands.band(cursor, "interchange");
        if (!(band.child instanceof BandNode inner)) {
            throw new OperatorPrecondition("interchange needs a band whose child is a band, found " + band.child.kind());
        }
        BandNode lower = new BandNode(band.schedule, band.loopTypes, inner.child);
        return cursor.replace(new BandNode(inner.schedule, inner.loopTypes, lower));
    }
}
