package polyopt.polyhedral.extract;

import polyopt.AST.expression.Expression;
import polyopt.polyhedral.affine.BasicSet;
import polyopt.polyhedral.affine.Constrain;

import java.util.ArrayList;
import java.util.List;

/**
 * A statement of a scop: one assignment with its iteration domain and
 * accesses. Reads are listed in evaluation order; a compound assignment
 * reads its target first.
 */
public class Assign {
    public String name;
    public List<String> iterators;
    public List<Constrain> constrains;
    public BasicSet domain;
    public MemVisit write;
    public List<MemVisit> read;
    public Expression exp;
    public int line;

    public Assign(String name_, List<String> iterators_, List<Constrain> constrains_) {
        name = name_;
        iterators = new ArrayList<>(iterators_);
        constrains = new ArrayList<>(constrains_);
        read = new ArrayList<>();
    }

    public void setWrite(MemVisit write_) {
        write = write_;
    }

    public void setRead(MemVisit read_) {
        read.add(read_);
    }
}
