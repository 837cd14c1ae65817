package polyopt.polyhedral.schedule;

import polyopt.polyhedral.affine.UnionSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flow-style text of a schedule tree, e.g.
 * {@code { domain: "[N] -> { S_0[i] : i >= 0 and -i + N - 1 >= 0 }", child: { schedule: "[N] -> L_0[{ S_0[i] -> [(i)] }]" } }}.
 * Leaves are left out.
 */
public class ScheduleTreePrinter {
    private UnionSet domain;

    public ScheduleTreePrinter(UnionSet domain_) {
        domain = domain_;
    }

    public String print(ScheduleNode node) {
        StringBuilder sb = new StringBuilder();
        printNode(node, sb);
        return sb.toString();
    }

    private void printNode(ScheduleNode node, StringBuilder sb) {
        List<String> entries = new ArrayList<>();
        switch (node.kind()) {
            case DOMAIN -> {
                domain = ((DomainNode) node).domain;
                entries.add("domain: " + quote(domain.toString()));
            }
            case BAND -> {
                BandNode band = (BandNode) node;
                entries.add("schedule: " + quote(band.schedule.toString()));
                if (band.loopTypes.stream().anyMatch(type -> type != LoopType.DEFAULT)) {
                    List<String> types = new ArrayList<>();
                    band.loopTypes.forEach(type -> types.add(type.text()));
                    entries.add("loop: [ " + String.join(", ", types) + " ]");
                }
            }
            case SEQUENCE, SET -> {
                List<String> children = new ArrayList<>();
                for (ScheduleNode child : node.children()) {
                    StringBuilder childText = new StringBuilder();
                    printNode(child, childText);
                    children.add(childText.toString());
                }
                String key = node.kind() == NodeKind.SEQUENCE ? "sequence" : "set";
                entries.add(key + ": [ " + String.join(", ", children) + " ]");
            }
            case FILTER -> entries.add("filter: " + quote(filterText(((FilterNode) node).statements)));
            case LEAF -> {
                sb.append("{ }");
                return;
            }
        }
        if (node.kind() != NodeKind.SEQUENCE && node.kind() != NodeKind.SET) {
            ScheduleNode child = node.child(0);
            if (child.kind() != NodeKind.LEAF) {
                StringBuilder childText = new StringBuilder();
                printNode(child, childText);
                entries.add("child: " + childText);
            }
        }
        sb.append("{ ").append(String.join(", ", entries)).append(" }");
    }

    private String filterText(Set<String> statements) {
        if (domain == null) {
            return "{ " + String.join("; ", statements) + " }";
        }
        return UnionSet.filterString(statements, domain);
    }

    private static String quote(String text) {
        return "\"" + text + "\"";
    }
}
