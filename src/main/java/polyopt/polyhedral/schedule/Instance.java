package polyopt.polyhedral.schedule;

import java.util.Arrays;

/**
 * One execution of a statement: its name and iterator values.
 */
public class Instance {
    public final int id;
    public final String name;
    public final long[] point;

    public Instance(int id_, String name_, long[] point_) {
        id = id_;
        name = name_;
        point = point_;
    }

    @Override
    public String toString() {
        return name + Arrays.toString(point);
    }
}
