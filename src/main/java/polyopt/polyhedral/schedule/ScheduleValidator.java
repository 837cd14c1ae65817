package polyopt.polyhedral.schedule;

import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.affine.UnionSet;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Checks that every statement instance reaches exactly one leaf and that
 * every band has one piece, of the right dimension, for each statement
 * reaching it.
 */
public class ScheduleValidator {
    public static void validate(DomainNode root) {
        check(root.child, root.domain, new LinkedHashSet<>(root.domain.names()), false);
    }

    private static void check(ScheduleNode node, UnionSet domain, Set<String> active, boolean underBranch) {
        switch (node.kind()) {
            case DOMAIN -> throw new ToolkitFailure("domain node below the root");
            case LEAF -> {
            }
            case BAND -> {
                BandNode band = (BandNode) node;
                if (band.dims() == 0) {
                    throw new ToolkitFailure("band without dimensions");
                }
                if (band.loopTypes.size() != band.dims()) {
                    throw new ToolkitFailure("band has " + band.loopTypes.size() + " loop types for " + band.dims() + " dimensions");
                }
                for (var dim : band.schedule.dims) {
                    if (!dim.names().equals(active)) {
                        throw new ToolkitFailure("band " + band.schedule.tupleId + " has pieces for " + dim.names()
                                + " but " + active + " reach it");
                    }
                    for (var piece : dim.pieces.values()) {
                        var set = domain.get(piece.name);
                        if (piece.dims.size() != set.dims.size()) {
                            throw new ToolkitFailure("piece " + piece + " does not match " + set.tupleString());
                        }
                        Set<String> known = new HashSet<>(piece.dims);
                        known.addAll(domain.params);
                        for (String variable : piece.expr.variables()) {
                            if (!known.contains(variable)) {
                                throw new ToolkitFailure("unknown variable " + variable + " in " + piece);
                            }
                        }
                    }
                }
                check(band.child, domain, active, false);
            }
            case SEQUENCE, SET -> {
                if (node.childCount() == 0) {
                    throw new ToolkitFailure(node.kind() + " without children");
                }
                Set<String> covered = new HashSet<>();
                for (ScheduleNode child : node.children()) {
                    if (!(child instanceof FilterNode filter)) {
                        throw new ToolkitFailure("children of a " + node.kind() + " must be filters");
                    }
                    for (String name : filter.statements) {
                        if (!covered.add(name)) {
                            throw new ToolkitFailure("statement " + name + " is in two filters");
                        }
                    }
                    check(child, domain, active, true);
                }
                if (!covered.containsAll(active)) {
                    Set<String> missing = new LinkedHashSet<>(active);
                    missing.removeAll(covered);
                    throw new ToolkitFailure("statements " + missing + " reach no child");
                }
            }
            case FILTER -> {
                FilterNode filter = (FilterNode) node;
                for (String name : filter.statements) {
                    if (!active.contains(name)) {
                        throw new ToolkitFailure("filter names " + name + " which does not reach it");
                    }
                }
                if (!underBranch && !filter.statements.containsAll(active)) {
                    throw new ToolkitFailure("filter drops statements outside a sequence or set");
                }
                check(filter.child, domain, new LinkedHashSet<>(filter.statements), false);
            }
        }
    }
}
