package polyopt.polyhedral.schedule;

import polyopt.polyhedral.affine.MultiUnionPwAff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BandNode extends ScheduleNode {
    public final MultiUnionPwAff schedule;
    public final List<LoopType> loopTypes;
    public final ScheduleNode child;

    public BandNode(MultiUnionPwAff schedule_, List<LoopType> loopTypes_, ScheduleNode child_) {
        schedule = schedule_;
        loopTypes = List.copyOf(loopTypes_);
        child = child_;
    }

    public BandNode(MultiUnionPwAff schedule_, ScheduleNode child_) {
        this(schedule_, Collections.nCopies(schedule_.size(), LoopType.DEFAULT), child_);
    }

    public int dims() {
        return schedule.size();
    }

    public BandNode withSchedule(MultiUnionPwAff schedule_) {
        if (schedule_.size() == loopTypes.size()) {
            return new BandNode(schedule_, loopTypes, child);
        }
        return new BandNode(schedule_, child);
    }

    public BandNode withLoopType(int pos, LoopType type) {
        List<LoopType> types = new ArrayList<>(loopTypes);
        types.set(pos, type);
        return new BandNode(schedule, types, child);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BAND;
    }

    @Override
    public List<ScheduleNode> children() {
        return List.of(child);
    }

    @Override
    public ScheduleNode withChildren(List<ScheduleNode> children) {
        return new BandNode(schedule, loopTypes, children.get(0));
    }
}
