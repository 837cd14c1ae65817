package polyopt.polyhedral.dependency;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.extract.Assign;
import polyopt.polyhedral.extract.Domain;
import polyopt.polyhedral.extract.MemVisit;
import polyopt.polyhedral.schedule.Instance;
import polyopt.polyhedral.schedule.ScheduleMap;
import polyopt.polyhedral.schedule.TimeVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statement instances of a scop in original execution order and the memory
 * based dependences between them.
 * <p>
 * Every access depends on the closest conflicting accesses before it: a read
 * on the last write of its cell, a write on the reads since that write and on
 * the write itself. Chains of such pairs order every conflicting pair, so the
 * relation constrains a schedule exactly as the full one does.
 */
public class Model {
    private static final Logger logger = LoggerFactory.getLogger(Model.class);

    public final Domain domain;
    public final Map<String, Long> params;
    public final List<Instance> instances;
    public final DependenceRelation dependences;
    private final HashMap<String, Assign> assigns;

    public Model(Domain domain_, Map<String, Long> params_, EnumSet<Dependency> kinds, long maxInstances) {
        domain = domain_;
        params = params_;
        assigns = new HashMap<>();
        for (Assign assign : domain.stmtList) {
            assigns.put(assign.name, assign);
        }
        instances = enumerate(maxInstances);
        dependences = new DependenceRelation();
        setDependency(kinds);
        logger.debug("{} instances, {}", instances.size(), dependences);
    }

    private List<Instance> enumerate(long maxInstances) {
        List<Instance> unsorted = new ArrayList<>();
        for (Assign assign : domain.stmtList) {
            for (long[] point : assign.domain.enumerate(params, maxInstances - unsorted.size())) {
                unsorted.add(new Instance(unsorted.size(), assign.name, point));
            }
        }
        ScheduleMap map = new ScheduleMap(domain.schedule);
        TimeVector[] times = map.times(unsorted, params);
        Integer[] order = new Integer[unsorted.size()];
        for (int i = 0; i < order.length; ++i) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> TimeVector.compare(times[a], times[b]));
        List<Instance> result = new ArrayList<>(order.length);
        for (int i = 0; i < order.length; ++i) {
            Instance old = unsorted.get(order[i]);
            if (i > 0 && TimeVector.compare(times[order[i - 1]], times[order[i]]) == 0) {
                throw new ToolkitFailure("instances " + unsorted.get(order[i - 1]) + " and " + old + " share a date");
            }
            result.add(new Instance(i, old.name, old.point));
        }
        return result;
    }

    public Map<String, Long> values(Instance instance) {
        Map<String, Long> values = new HashMap<>(params);
        List<String> iterators = assigns.get(instance.name).iterators;
        for (int i = 0; i < iterators.size(); ++i) {
            values.put(iterators.get(i), instance.point[i]);
        }
        return values;
    }

    private void setDependency(EnumSet<Dependency> kinds) {
        boolean trackOutput = kinds.contains(Dependency.OUTPUT);
        Object2IntOpenHashMap<String> lastWrite = new Object2IntOpenHashMap<>();
        lastWrite.defaultReturnValue(-1);
        // without output dependences no write separates earlier accesses from later ones
        Object2ObjectOpenHashMap<String, IntArrayList> readers = new Object2ObjectOpenHashMap<>();
        Object2ObjectOpenHashMap<String, IntArrayList> writers = new Object2ObjectOpenHashMap<>();
        for (Instance instance : instances) {
            Assign assign = assigns.get(instance.name);
            Map<String, Long> values = values(instance);
            for (MemVisit read : assign.read) {
                String cell = read.cell(values);
                if (kinds.contains(Dependency.FLOW)) {
                    if (trackOutput) {
                        int write = lastWrite.getInt(cell);
                        if (write >= 0 && write != instance.id) {
                            dependences.add(write, instance.id, Dependency.FLOW);
                        }
                    } else {
                        for (int write : writers.getOrDefault(cell, new IntArrayList())) {
                            if (write != instance.id) {
                                dependences.add(write, instance.id, Dependency.FLOW);
                            }
                        }
                    }
                }
                readers.computeIfAbsent(cell, key -> new IntArrayList()).add(instance.id);
            }
            String cell = assign.write.cell(values);
            if (kinds.contains(Dependency.ANTI)) {
                for (int reader : readers.getOrDefault(cell, new IntArrayList())) {
                    if (reader != instance.id) {
                        dependences.add(reader, instance.id, Dependency.ANTI);
                    }
                }
            }
            if (trackOutput) {
                int write = lastWrite.getInt(cell);
                if (write >= 0 && write != instance.id) {
                    dependences.add(write, instance.id, Dependency.OUTPUT);
                }
                lastWrite.put(cell, instance.id);
                readers.remove(cell);
            } else {
                writers.computeIfAbsent(cell, key -> new IntArrayList()).add(instance.id);
            }
        }
    }
}
