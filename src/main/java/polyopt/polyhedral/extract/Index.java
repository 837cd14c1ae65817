package polyopt.polyhedral.extract;

import polyopt.polyhedral.affine.Affine;
import polyopt.polyhedral.affine.Constrain;

import java.util.ArrayList;
import java.util.List;

/**
 * A loop iterator with the constraints its header puts on it.
 */
public class Index {
    public String varName;
    public String bandId;
    public Affine boundFrom;
    public long step;
    public List<Constrain> constrains;

    public Index(String varName_, String bandId_) {
        varName = varName_;
        bandId = bandId_;
        constrains = new ArrayList<>();
    }

    public boolean decreasing() {
        return step < 0;
    }
}
