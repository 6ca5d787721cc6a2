package vn.legaldoc.structure.html;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Line extractor backed by jsoup's lenient HTML parser.
 *
 * <p>Block-level elements and {@code <br>} end the current line, so text nested in several
 * blocks is emitted exactly once, in document order.
 */
public class JsoupLineExtractor implements LineExtractor {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "table", "tr", "td", "th",
            "li", "ul", "ol", "blockquote", "section", "article", "center", "body");
    private static final Set<String> BOLD_TAGS = Set.of("b", "strong", "h3", "h4", "h5");
    private static final Pattern HEAVY_WEIGHT = Pattern.compile(
            "font-weight\\s*:\\s*(bold|bolder|[6-9]00)", Pattern.CASE_INSENSITIVE);
    static final String TITLE_ANCHOR_SUFFIX = "_name";

    @Override
    public List<SourceLine> extract(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html);
        Element container = locateContainer(document);
        container.select("script, style, iframe").remove();

        LineCollector collector = new LineCollector();
        NodeTraversor.traverse(collector, container);
        collector.flush();
        return collector.lines;
    }

    @Override
    public Optional<String> extractTitle(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        Element heading = document.selectFirst("h1");
        return Optional.ofNullable(heading)
                .map(Element::text)
                .map(TextCleaner::clean)
                .filter(value -> !value.isEmpty())
                .or(() -> Optional.of(TextCleaner.clean(document.title())).filter(value -> !value.isEmpty()));
    }

    private Element locateContainer(Document document) {
        Element content = document.selectFirst("div.content1");
        if (content != null) {
            return content;
        }
        Element contentBody = document.selectFirst("div#contentBody");
        if (contentBody != null) {
            return contentBody;
        }
        return document.body() != null ? document.body() : document;
    }

    static boolean isStructuralAnchor(String name) {
        return name != null && !name.isBlank() && !name.endsWith(TITLE_ANCHOR_SUFFIX);
    }

    private static boolean rendersBold(Element element) {
        if (BOLD_TAGS.contains(element.normalName())) {
            return true;
        }
        String style = element.attr("style");
        return !style.isEmpty() && HEAVY_WEIGHT.matcher(style).find();
    }

    private static final class LineCollector implements NodeVisitor {

        private final List<SourceLine> lines = new ArrayList<>();
        private final Deque<Boolean> boldScopes = new ArrayDeque<>();
        private final StringBuilder buffer = new StringBuilder();
        private boolean bold;
        private String anchor;
        private String pendingAnchor;

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                String text = textNode.getWholeText();
                buffer.append(text);
                if (!text.isBlank() && Boolean.TRUE.equals(boldScopes.peek())) {
                    bold = true;
                }
                return;
            }
            if (!(node instanceof Element element)) {
                return;
            }
            String tag = element.normalName().toLowerCase(Locale.ROOT);
            if (BLOCK_TAGS.contains(tag) || "br".equals(tag)) {
                flush();
            }
            boolean inherited = Boolean.TRUE.equals(boldScopes.peek());
            boldScopes.push(inherited || rendersBold(element));
            if ("a".equals(tag) && anchor == null && isStructuralAnchor(element.attr("name"))) {
                anchor = element.attr("name").trim();
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (!(node instanceof Element element)) {
                return;
            }
            boldScopes.poll();
            if (BLOCK_TAGS.contains(element.normalName().toLowerCase(Locale.ROOT))) {
                flush();
            }
        }

        void flush() {
            String text = TextCleaner.clean(buffer.toString());
            if (text.isEmpty()) {
                if (anchor != null) {
                    pendingAnchor = anchor;
                }
            } else {
                String effectiveAnchor = anchor != null ? anchor : pendingAnchor;
                lines.add(SourceLine.anchored(text, bold, effectiveAnchor));
                pendingAnchor = null;
            }
            buffer.setLength(0);
            bold = false;
            anchor = null;
        }
    }
}
