package vn.legaldoc.structure.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LegalNodeTest {

    @Test
    void rejectsChildrenThatDoNotNestDeeper() {
        LegalNode item = new LegalNode(NodeType.ITEM, "1", List.of(), List.of(), Optional.empty());

        assertThatThrownBy(() -> new LegalNode(NodeType.ARTICLE, "Điều 1", List.of(), List.of(item), Optional.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ITEM");
    }

    @Test
    void joinsContentAndFlattensInPreOrder() {
        LegalNode point = new LegalNode(NodeType.POINT, "a)", List.of("foo"), List.of(), Optional.empty());
        LegalNode clause = new LegalNode(NodeType.CLAUSE, "1", List.of("xyz", "tiếp"), List.of(point), Optional.empty());
        LegalNode root = new LegalNode(NodeType.DOCUMENT, "T", null, List.of(clause), null);

        assertThat(clause.joinedContent()).isEqualTo("xyz\ntiếp");
        assertThat(root.joinedContent()).isEmpty();
        assertThat(root.anchorId()).isEmpty();
        assertThat(root.flatten()).extracting(LegalNode::title).containsExactly("T", "1", "a)");
    }

    @Test
    void wireNamesRoundTripThroughNodeType() {
        assertThat(NodeType.SUBITEM.wireName()).isEqualTo("subitem");
        assertThat(NodeType.fromWireName(" Article ")).isEqualTo(NodeType.ARTICLE);
        assertThat(NodeType.ITEM.level()).isEqualTo(NodeType.ARTICLE.level());
        assertThatThrownBy(() -> NodeType.fromWireName("khoan")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resultRequiresDocumentRoot() {
        LegalNode article = new LegalNode(NodeType.ARTICLE, "Điều 1", List.of(), List.of(), Optional.empty());

        assertThatThrownBy(() -> new DocumentResult(article, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(DocumentResult.empty("T").metadata().isEmpty()).isTrue();
    }
}
