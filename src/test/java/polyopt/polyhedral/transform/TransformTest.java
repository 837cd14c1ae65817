package polyopt.polyhedral.transform;

import org.junit.jupiter.api.Test;
import polyopt.Util.error.OperatorPrecondition;
import polyopt.polyhedral.affine.MultiUnionPwAff;
import polyopt.polyhedral.affine.QuasiAffine;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.Extractor;
import polyopt.polyhedral.extract.ScopSource;
import polyopt.polyhedral.schedule.BandNode;
import polyopt.polyhedral.schedule.FilterNode;
import polyopt.polyhedral.schedule.LoopType;
import polyopt.polyhedral.schedule.NodeKind;
import polyopt.polyhedral.schedule.ScheduleCursor;
import polyopt.polyhedral.schedule.ScheduleTreeReader;
import polyopt.polyhedral.schedule.ScheduleValidator;
import polyopt.polyhedral.schedule.SequenceNode;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TransformTest {
    private static final QuasiAffine i = QuasiAffine.variable("i");
    private static final QuasiAffine j = QuasiAffine.variable("j");

    private static ScheduleCursor load(String body) {
        Domain domain = new Domain(Extractor.parse(new ScopSource(0, body, 0, body.length(), 1, "")));
        return new ScheduleCursor(domain.schedule);
    }

    private static QuasiAffine piece(ScheduleCursor cursor, String name) {
        return ((BandNode) cursor.node()).schedule.get(0).get(name).expr;
    }

    private static final String single = "for (int i = 0; i < N; i++)\n  A[i] = 0;\n";
    private static final String nest = "for (int i = 0; i < N; i++)\n  for (int j = 0; j < N; j++)\n    A[i][j] = 0;\n";
    private static final String twoLoops = """
            for (int i = 0; i < N; i++)
              A[i] = i;
            for (int i = 0; i < N; i++)
              B[i] = A[i];
            """;

    @Test
    void tileSplitsTheBand() {
        ScheduleCursor band = load(single).child(0);
        ScheduleCursor tiled = Tile.tile(band, 4);
        assertEquals("0", tiled.pathText());
        BandNode outer = (BandNode) tiled.node();
        BandNode inner = (BandNode) outer.child;
        assertEquals(i.floorDiv(4), outer.schedule.get(0).get("S_0").expr);
        assertEquals(i, inner.schedule.get(0).get("S_0").expr);
        assertEquals("L_0", outer.schedule.tupleId);
        assertEquals("L_0", inner.schedule.tupleId);
        assertEquals(NodeKind.LEAF, inner.child.kind());
        ScheduleValidator.validate(tiled.rootNode());

        assertThrows(OperatorPrecondition.class, () -> Tile.tile(band, 0));
        assertThrows(OperatorPrecondition.class, () -> Tile.tile(band.root(), 4));
    }

    @Test
    void interchangeSwapsNestedBands() {
        ScheduleCursor outer = load(nest).child(0);
        ScheduleCursor swapped = Interchange.interchange(outer);
        assertEquals("L_1", ((BandNode) swapped.node()).schedule.tupleId);
        assertEquals(j, piece(swapped, "S_0"));
        assertEquals(i, piece(swapped.child(0), "S_0"));
        assertThrows(OperatorPrecondition.class, () -> Interchange.interchange(swapped.child(0)));
        assertThrows(OperatorPrecondition.class, () -> Interchange.interchange(load(single).child(0)));
    }

    @Test
    void fuseMergesSiblingBands() {
        ScheduleCursor sequence = load(twoLoops).child(0);
        ScheduleCursor fused = Fuse.fuse(sequence, 1, 0);
        assertEquals(NodeKind.SEQUENCE, fused.node().kind());
        assertEquals(1, fused.node().childCount());
        FilterNode branch = (FilterNode) fused.node().child(0);
        assertEquals(Set.of("S_0", "S_1"), branch.statements);
        BandNode band = (BandNode) branch.child;
        assertEquals("", band.schedule.tupleId);
        assertEquals(List.of("N"), band.schedule.params);
        assertEquals(i, band.schedule.get(0).get("S_1").expr);
        SequenceNode below = (SequenceNode) band.child;
        assertEquals(Set.of("S_0"), ((FilterNode) below.children.get(0)).statements);
        ScheduleValidator.validate(fused.rootNode());
    }

    @Test
    void fusePreconditions() {
        ScheduleCursor sequence = load(twoLoops).child(0);
        assertThrows(OperatorPrecondition.class, () -> Fuse.fuse(sequence, 0, 0));
        assertThrows(OperatorPrecondition.class, () -> Fuse.fuse(sequence, 0, 2));
        assertThrows(OperatorPrecondition.class, () -> Fuse.fuse(sequence.child(0), 0, 1));
        ScheduleCursor mixed = load("for (int i = 0; i < N; i++)\n  A[i] = i;\nx = 1;\n").child(0);
        assertThrows(OperatorPrecondition.class, () -> Fuse.fuse(mixed, 0, 1));
        assertThrows(OperatorPrecondition.class, () -> Fuse.fuseAll(mixed));
    }

    @Test
    void fuseAllLeavesOneChild() {
        ScheduleCursor sequence = load(twoLoops + "for (int i = 0; i < N; i++)\n  C[i] = B[i];\n").child(0);
        assertEquals(3, sequence.node().childCount());
        ScheduleCursor fused = Fuse.fuseAll(sequence);
        assertEquals(1, fused.node().childCount());
        assertEquals(Set.of("S_0", "S_1", "S_2"), ((FilterNode) fused.node().child(0)).statements);
        ScheduleValidator.validate(fused.rootNode());
    }

    @Test
    void shiftsAddToThePieces() {
        ScheduleCursor band = Fuse.fuse(load(twoLoops).child(0), 0, 1).follow("0.0.0");
        assertEquals(i.add(QuasiAffine.constant(3)), piece(Shift.fullShiftValue(band, 3), "S_0"));
        assertEquals(i.mul(3), piece(Shift.fullShiftVariable(band, 2, 0), "S_1"));
        assertEquals(i.add(QuasiAffine.variable("N").mul(-1)), piece(Shift.fullShiftParam(band, -1, 0), "S_1"));

        ScheduleCursor partial = Shift.partialShiftValue(band, 1, 2);
        assertEquals(i, piece(partial, "S_0"));
        assertEquals(i.add(QuasiAffine.constant(2)), piece(partial, "S_1"));
        assertEquals(i.mul(2), piece(Shift.partialShiftVariable(band, 0, 1, 0), "S_0"));
        assertEquals(i, piece(Shift.partialShiftParam(band, 0, 1, 0), "S_1"));
        assertEquals(((BandNode) band.node()).schedule.tupleId, ((BandNode) partial.node()).schedule.tupleId);
    }

    @Test
    void shiftPreconditions() {
        ScheduleCursor band = load(single).child(0);
        assertThrows(OperatorPrecondition.class, () -> Shift.partialShiftValue(band, 1, 2));
        assertThrows(OperatorPrecondition.class, () -> Shift.partialShiftValue(band, -2, 2));
        assertThrows(OperatorPrecondition.class, () -> Shift.fullShiftVariable(band, 1, 1));
        assertThrows(OperatorPrecondition.class, () -> Shift.fullShiftParam(band, 1, 1));
        assertThrows(OperatorPrecondition.class, () -> Shift.fullShiftValue(band.root(), 1));

        MultiUnionPwAff twoDims = new ScheduleTreeReader().parseSchedule(
                "[N] -> L_0[{ S_0[i, j] -> [(i)] }, { S_0[i, j] -> [(j)] }]");
        ScheduleCursor nested = load(nest).child(0);
        BandNode outer = (BandNode) nested.node();
        ScheduleCursor wide = nested.replace(new BandNode(twoDims, ((BandNode) outer.child).child));
        assertThrows(OperatorPrecondition.class, () -> Shift.fullShiftValue(wide, 1));
    }

    @Test
    void scaleMultipliesEveryDimension() {
        ScheduleCursor band = load(single).child(0);
        assertEquals(i.mul(-2), piece(Scale.scale(band, -2), "S_0"));
        assertThrows(OperatorPrecondition.class, () -> Scale.scale(band, 0));
    }

    @Test
    void loopHintsOnlyChangeTypes() {
        ScheduleCursor band = load(single).child(0);
        ScheduleCursor parallel = LoopHint.setParallel(band);
        assertEquals(List.of(LoopType.PARALLEL), ((BandNode) parallel.node()).loopTypes);
        assertSame(((BandNode) band.node()).schedule, ((BandNode) parallel.node()).schedule);
        ScheduleCursor unrolled = LoopHint.setLoopOpt(band, 0, LoopType.UNROLL);
        assertEquals(List.of(LoopType.UNROLL), ((BandNode) unrolled.node()).loopTypes);
        assertThrows(OperatorPrecondition.class, () -> LoopHint.setLoopOpt(band, 1, LoopType.UNROLL));
        assertThrows(OperatorPrecondition.class, () -> LoopHint.setParallel(band.root()));
    }

    @Test
    void transformationNames() {
        assertEquals(Transformation.FUSE_ALL, Transformation.parse("fuseall"));
        assertEquals(3, Transformation.parse("partialShiftParam").argCount);
        assertThrows(OperatorPrecondition.class, () -> Transformation.parse("skew"));
    }
}
