package vn.legaldoc.structure.html;

import java.util.List;
import java.util.Optional;

/**
 * Turns raw document HTML into the ordered line sequence consumed by the parser.
 */
public interface LineExtractor {

    List<SourceLine> extract(String html);

    Optional<String> extractTitle(String html);
}
