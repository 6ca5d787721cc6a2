package vn.legaldoc.structure.parse;

import java.util.Objects;
import vn.legaldoc.structure.model.NodeType;

/**
 * What the classifier can see of the open path: the innermost node and the innermost node that
 * is not a point.
 */
public record OpenContext(NodeType top, NodeType nearestNonPoint) {

    public OpenContext {
        Objects.requireNonNull(top, "top");
        Objects.requireNonNull(nearestNonPoint, "nearestNonPoint");
    }

    public static OpenContext atRoot() {
        return new OpenContext(NodeType.DOCUMENT, NodeType.DOCUMENT);
    }
}
