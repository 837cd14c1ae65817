package polyopt.polyhedral.transform;

import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.affine.MultiUnionPwAff;
import polyopt.polyhedral.affine.UnionPwAff;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.FilterNode;
import polyopt.polyhedral.schedule.NodeKind;
import polyopt.polyhedral.schedule.ScheduleCursor;
import polyopt.polyhedral.schedule.ScheduleNode;
import polyopt.polyhedral.schedule.SequenceNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loop fusion of two children of a sequence or set.
 * <p>
 * Children {@code i} and {@code j} are replaced, at position {@code min(i, j)},
 * by one branch: a filter on both statement sets, a band that is the union of
 * the two top bands, and below it a sequence of the two original filters with
 * what was under their bands. The cursor stays on the sequence or set.
 */
public class Fuse {
    public static ScheduleCursor fuse(ScheduleCursor cursor, int i, int j) {
        ScheduleNode node = cursor.node();
        if (node.kind() != NodeKind.SEQUENCE && node.kind() != NodeKind.SET) {
            throw new OperatorPrecondition("fuse needs a sequence or set node, found " + node.kind());
        }
        if (i == j) {
            throw new OperatorPrecondition("fuse needs two different children, got " + i + " twice");
        }
        int count = node.childCount();
        if (i < 0 || j < 0 || i >= count || j >= count) {
            throw new OperatorPrecondition("fuse children " + i + ", " + j + " out of range, node has " + count + " children");
        }
        int lo = Math.min(i, j);
        int hi = Math.max(i, j);
        FilterNode first = (FilterNode) node.child(lo);
        FilterNode second = (FilterNode) node.child(hi);
        BandNode firstBand = topBand(first, lo);
        BandNode secondBand = topBand(second, hi);
        if (firstBand.dims() != secondBand.dims()) {
            throw new OperatorPrecondition("fuse needs bands of equal dimension, found " + firstBand.dims()
                    + " and " + secondBand.dims());
        }
        List<UnionPwAff> dims = new ArrayList<>();
        for (int k = 0; k < firstBand.dims(); ++k) {
            UnionPwAff a = firstBand.schedule.get(k).restrict(first.statements);
            UnionPwAff b = secondBand.schedule.get(k).restrict(second.statements);
            dims.add(a.union(b));
        }
        MultiUnionPwAff merged = new MultiUnionPwAff("", firstBand.schedule.params, dims);
        ScheduleNode below = new SequenceNode(List.of(
                new FilterNode(first.statements, firstBand.child),
                new FilterNode(second.statements, secondBand.child)));
        Set<String> statements = new LinkedHashSet<>(first.statements);
        statements.addAll(second.statements);
        ScheduleNode branch = new FilterNode(statements, new BandNode(merged, below));

        List<ScheduleNode> children = new ArrayList<>(node.children());
        children.remove(hi);
        children.set(lo, branch);
        return cursor.replace(node.withChildren(children));
    }

    /**
     * Fuses the children of a sequence or set pairwise, front to back, until
     * one is left.
     */
    public static ScheduleCursor fuseAll(ScheduleCursor cursor) {
        ScheduleNode node = cursor.node();
        if (node.kind() != NodeKind.SEQUENCE && node.kind() != NodeKind.SET) {
            throw new OperatorPrecondition("fuse needs a sequence or set node, found " + node.kind());
        }
        for (int pos = 0; pos < node.childCount(); ++pos) {
            topBand((FilterNode) node.child(pos), pos);
        }
        while (cursor.node().childCount() > 1) {
            cursor = fuse(cursor, 0, 1);
        }
        return cursor;
    }

    private static BandNode topBand(FilterNode filter, int pos) {
        if (!(filter.child instanceof BandNode band)) {
            throw new OperatorPrecondition("child " + pos + " does not start with a band, found " + filter.child.kind());
        }
        return band;
    }
}
