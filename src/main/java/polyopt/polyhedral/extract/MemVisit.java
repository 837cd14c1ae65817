package polyopt.polyhedral.extract;

import polyopt.polyhedral.affine.Affine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One array (or scalar, with no subscripts) access of a statement.
 */
public class MemVisit {
    public String varName;
    public List<Affine> addr;

    public MemVisit() {
        addr = new ArrayList<>();
    }

    public MemVisit(MemVisit obj) {
        varName = obj.varName;
        addr = new ArrayList<>();
        for (Affine affine : obj.addr) {
            addr.add(new Affine(affine));
        }
    }

    public void setVarName(String varName_) {
        varName = varName_;
    }

    public void addDim(Affine affine) {
        addr.add(affine);
    }

    /**
     * Key of the memory cell touched for the given iterator and parameter
     * values, e.g. {@code A[3][4]}.
     */
    public String cell(Map<String, Long> values) {
        StringBuilder sb = new StringBuilder(varName);
        for (Affine affine : addr) {
            sb.append('[').append(affine.evaluate(values)).append(']');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(varName);
        for (Affine affine : addr) {
            sb.append('[').append(affine).append(']');
        }
        return sb.toString();
    }
}
