package vn.legaldoc.structure.output;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import vn.legaldoc.structure.model.LegalNode;
import vn.legaldoc.structure.model.NodeType;

/**
 * Node counts of a parsed tree, excluding the document root.
 */
public final class StructureStatistics {

    private final Map<NodeType, Integer> counts;
    private final List<LegalNode> articles;

    private StructureStatistics(Map<NodeType, Integer> counts, List<LegalNode> articles) {
        this.counts = counts;
        this.articles = articles;
    }

    public static StructureStatistics of(LegalNode root) {
        Map<NodeType, Integer> counts = new EnumMap<>(NodeType.class);
        root.flatten()
                .filter(node -> node != root)
                .forEach(node -> counts.merge(node.type(), 1, Integer::sum));
        List<LegalNode> articles = root.flatten()
                .filter(node -> node.type() == NodeType.ARTICLE)
                .collect(Collectors.toUnmodifiableList());
        return new StructureStatistics(Collections.unmodifiableMap(counts), articles);
    }

    public int count(NodeType type) {
        return counts.getOrDefault(type, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<NodeType, Integer> counts() {
        return counts;
    }

    public List<LegalNode> articles() {
        return articles;
    }

    /**
     * Merges another document's counts into a running total.
     */
    public static Map<NodeType, Integer> sum(Map<NodeType, Integer> left, Map<NodeType, Integer> right) {
        Map<NodeType, Integer> total = new EnumMap<>(NodeType.class);
        total.putAll(left);
        right.forEach((type, count) -> total.merge(type, count, Integer::sum));
        return total;
    }

    @Override
    public String toString() {
        return counts.entrySet().stream()
                .map(entry -> entry.getKey().wireName() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
