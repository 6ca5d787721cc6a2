package vn.legaldoc.structure.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import vn.legaldoc.structure.model.LegalNode;
import vn.legaldoc.structure.model.NodeType;

class NodeArenaTest {

    @Test
    void attachClosesSameAndDeeperLevels() {
        NodeArena arena = new NodeArena("Luật", true);
        arena.attach(Candidate.header(NodeType.CHAPTER, "Chương I", Optional.empty()));
        arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 1", Optional.empty()));
        arena.attach(Candidate.numbered(NodeType.CLAUSE, "1", "Khoản", Optional.empty()));
        assertThat(arena.openTypes()).containsExactly(NodeType.DOCUMENT, NodeType.CHAPTER, NodeType.ARTICLE, NodeType.CLAUSE);

        arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 2", Optional.empty()));
        assertThat(arena.openTypes()).containsExactly(NodeType.DOCUMENT, NodeType.CHAPTER, NodeType.ARTICLE);

        arena.attach(Candidate.header(NodeType.CHAPTER, "Chương II", Optional.empty()));
        assertThat(arena.openTypes()).containsExactly(NodeType.DOCUMENT, NodeType.CHAPTER);

        LegalNode root = arena.freeze();
        assertThat(root.children()).extracting(LegalNode::title).containsExactly("Chương I", "Chương II");
        assertThat(root.children().get(0).children()).extracting(LegalNode::title).containsExactly("Điều 1", "Điều 2");
    }

    @Test
    void contentGoesToInnermostOpenNode() {
        NodeArena arena = new NodeArena("T", false);
        arena.appendContent("Lời nói đầu");
        arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 1", Optional.empty()));
        arena.appendContent("  Nội dung  ");
        arena.appendContent(" ");

        LegalNode root = arena.freeze();

        assertThat(root.content()).containsExactly("Lời nói đầu");
        assertThat(root.children().get(0).content()).containsExactly("Nội dung");
    }

    @Test
    void echoedHeaderIsMergedIntoPreviousSibling() {
        NodeArena arena = new NodeArena("T", true);
        arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 3", Optional.empty()));
        arena.appendContent("Dòng một");
        int merged = arena.attach(new Candidate(NodeType.ARTICLE, "Điều 3. Hiệu lực", List.of("Dòng hai"),
                Optional.of("dieu_3")));
        arena.attach(Candidate.numbered(NodeType.CLAUSE, "1", "Khoản", Optional.empty()));

        LegalNode root = arena.freeze();

        assertThat(merged).isEqualTo(1);
        assertThat(arena.mergedCount()).isEqualTo(1);
        assertThat(root.children()).singleElement().satisfies(article -> {
            assertThat(article.title()).isEqualTo("Điều 3. Hiệu lực");
            assertThat(article.content()).containsExactly("Dòng một", "Dòng hai");
            assertThat(article.anchorId()).contains("dieu_3");
            assertThat(article.children()).extracting(LegalNode::title).containsExactly("1");
        });
    }

    @Test
    void mergingDisabledKeepsBothNodes() {
        NodeArena arena = new NodeArena("T", false);
        arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 3", Optional.empty()));
        arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 3", Optional.empty()));

        assertThat(arena.freeze().children()).hasSize(2);
    }

    @Test
    void contextReportsNearestNonPointNode() {
        NodeArena arena = new NodeArena("T", false);
        assertThat(arena.context()).isEqualTo(OpenContext.atRoot());

        arena.attach(Candidate.numbered(NodeType.ITEM, "1", null, Optional.empty()));
        arena.attach(Candidate.numbered(NodeType.POINT, "a)", "x", Optional.empty()));

        assertThat(arena.context()).isEqualTo(new OpenContext(NodeType.POINT, NodeType.ITEM));
    }

    @Test
    void rootCannotBeClosedAndPathMustDeepen() {
        NodeArena arena = new NodeArena("T", false);
        assertThatThrownBy(arena::pop).isInstanceOf(IllegalStateException.class);

        int article = arena.attach(Candidate.header(NodeType.ARTICLE, "Điều 1", Optional.empty()));
        assertThatThrownBy(() -> arena.push(article)).isInstanceOf(IllegalStateException.class);
        assertThat(arena.pop()).isEqualTo(article);
        assertThat(arena.top()).isZero();
    }
}
