package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;

/**
 * Schedule tree operators by the name a script uses, with the number of
 * arguments each takes.
 */
public enum Transformation {
    TILE("tile", 1),
    INTERCHANGE("interchange", 0),
    FUSE("fuse", 2),
    FUSE_ALL("fuseAll", 0),
    FULL_SHIFT_VALUE("fullShiftValue", 1),
    FULL_SHIFT_VARIABLE("fullShiftVariable", 2),
    FULL_SHIFT_PARAM("fullShiftParam", 2),
    PARTIAL_SHIFT_VALUE("partialShiftValue", 2),
    PARTIAL_SHIFT_VARIABLE("partialShiftVariable", 3),
    PARTIAL_SHIFT_PARAM("partialShiftParam", 3),
    SCALE("scale", 1),
    PARALLEL("parallel", 0),
    LOOP_OPT("loopOpt", 2);

    public final String command;
    public final int argCount;

    Transformation(String command_, int argCount_) {
        command = command_;
        argCount = argCount_;
    }

    public static Transformation parse(String command) {
        for (Transformation transformation : values()) {
            if (transformation.command.equalsIgnoreCase(command.trim())) {
                return transformation;
            }
        }
        throw new OperatorPrecondition("unknown transformation " + command);
    }
}
