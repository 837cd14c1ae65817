package polyopt.polyhedral.legality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.polyhedral.dependency.DependenceRelation;
import polyopt.polyhedral.schedule.DomainNode;
import polyopt.polyhedral.schedule.Instance;
import polyopt.polyhedral.schedule.ScheduleCursor;
import polyopt.polyhedral.schedule.ScheduleMap;
import polyopt.polyhedral.schedule.TimeVector;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A schedule is legal when it runs the target of every dependence strictly
 * after its source.
 */
public class LegalityChecker {
    private static final Logger logger = LoggerFactory.getLogger(LegalityChecker.class);

    private final List<Instance> instances;
    private final Map<String, Long> params;
    private final DependenceRelation dependences;

    public LegalityChecker(List<Instance> instances_, Map<String, Long> params_, DependenceRelation dependences_) {
        instances = instances_;
        params = params_;
        dependences = dependences_;
    }

    public TimeVector[] times(DomainNode root) {
        return new ScheduleMap(root).times(instances, params);
    }

    public boolean isLegal(DomainNode root) {
        if (dependences.isEmpty()) {
            return true;
        }
        TimeVector[] times = times(root);
        for (int i = 0; i < dependences.size(); ++i) {
            int source = dependences.source(i);
            int target = dependences.target(i);
            if (!times[source].precedes(times[target])) {
                logger.debug("violated: {} at {} -> {} at {}", instances.get(source), times[source],
                        instances.get(target), times[target]);
                return false;
            }
        }
        return true;
    }

    /**
     * True when no dependence links two instances that reach the band at
     * {@code cursor}, agree on every date entry above it and differ on its
     * first dimension.
     */
    public boolean isParallel(ScheduleCursor cursor) {
        if (dependences.isEmpty()) {
            return true;
        }
        Set<String> reaching = cursor.activeStatements();
        int position = ScheduleMap.depthOf(cursor);
        TimeVector[] times = times(cursor.rootNode());
        for (int i = 0; i < dependences.size(); ++i) {
            Instance source = instances.get(dependences.source(i));
            Instance target = instances.get(dependences.target(i));
            if (!reaching.contains(source.name) || !reaching.contains(target.name)) {
                continue;
            }
            long[] a = times[source.id].values;
            long[] b = times[target.id].values;
            boolean samePrefix = true;
            for (int k = 0; k < position; ++k) {
                if (a[k] != b[k]) {
                    samePrefix = false;
                    break;
                }
            }
            if (samePrefix && a[position] != b[position]) {
                logger.debug("carried by the band: {} -> {}", source, target);
                return false;
            }
        }
        return true;
    }
}
