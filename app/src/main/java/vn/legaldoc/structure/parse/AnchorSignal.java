package vn.legaldoc.structure.parse;

import java.util.Map;
import java.util.Optional;
import vn.legaldoc.structure.model.NodeType;

/**
 * Maps HTML anchor names of the source CMS to node types. The prefixes and the {@code _name}
 * exclusion are part of the input contract.
 */
public final class AnchorSignal {

    static final String TITLE_SUFFIX = "_name";

    private static final Map<String, NodeType> PREFIXES = Map.of(
            "dieu_", NodeType.ARTICLE,
            "chuong_", NodeType.CHAPTER,
            "phan_", NodeType.PART,
            "muc_", NodeType.SECTION,
            "khoan_", NodeType.CLAUSE);

    private AnchorSignal() {
    }

    public static Optional<NodeType> typeOf(Optional<String> anchorId) {
        return anchorId.flatMap(AnchorSignal::typeOf);
    }

    public static Optional<NodeType> typeOf(String anchorId) {
        if (anchorId == null || anchorId.isBlank() || anchorId.endsWith(TITLE_SUFFIX)) {
            return Optional.empty();
        }
        return PREFIXES.entrySet().stream()
                .filter(entry -> anchorId.startsWith(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
