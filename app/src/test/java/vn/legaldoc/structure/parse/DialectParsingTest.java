package vn.legaldoc.structure.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import vn.legaldoc.structure.model.DocumentResult;
import vn.legaldoc.structure.model.LegalNode;
import vn.legaldoc.structure.model.NodeType;

class DialectParsingTest {

    @Test
    void directiveBuildsItemsSubitemsAndPoints() {
        String html = "<div class=\"content1\">"
                + "<p><b>THÔNG BÁO</b></p>"
                + "<p>Kết luận của Thủ tướng Chính phủ tại cuộc họp.</p>"
                + "<p>1. Về công tác phòng, chống dịch</p>"
                + "<p>1.1. Các bộ, ngành tiếp tục theo dõi.</p>"
                + "<p>a) Bộ Y tế chủ trì;</p>"
                + "<p>1.2. Địa phương chủ động.</p>"
                + "<p>2. Về kinh tế</p>"
                + "<p>Giao Bộ Kế hoạch và Đầu tư tổng hợp.</p>"
                + "<p>Nơi nhận:</p><p>- Thủ tướng, các Phó Thủ tướng;</p>"
                + "<p><b>KT. BỘ TRƯỞNG, CHỦ NHIỆM</b></p>"
                + "</div>";

        DocumentResult result = LegalDocumentParser.forDocumentType("Thông báo").parse(html, "Thông báo 123");
        LegalNode root = result.root();

        assertThat(root.content()).containsExactly("THÔNG BÁO", "Kết luận của Thủ tướng Chính phủ tại cuộc họp.");
        assertThat(root.children()).extracting(LegalNode::type).containsExactly(NodeType.ITEM, NodeType.ITEM);
        LegalNode first = root.children().get(0);
        assertThat(first.children()).extracting(LegalNode::title).containsExactly("1.1", "1.2");
        assertThat(first.children()).extracting(LegalNode::type).containsOnly(NodeType.SUBITEM);
        assertThat(first.children().get(0).children()).singleElement()
                .satisfies(point -> assertThat(point.type()).isEqualTo(NodeType.POINT));
        assertThat(root.children().get(1).content()).containsExactly("Về kinh tế", "Giao Bộ Kế hoạch và Đầu tư tổng hợp.");
        assertThat(result.metadata().recipients()).containsExactly("Nơi nhận:", "- Thủ tướng, các Phó Thủ tướng;");
        assertThat(result.metadata().signers()).containsExactly("KT. BỘ TRƯỞNG, CHỦ NHIỆM");
    }

    @Test
    void planBuildsRomanSectionsWithItems() {
        String html = "<div class=\"content1\">"
                + "<p><b>KẾ HOẠCH</b></p>"
                + "<p><b>I. MỤC ĐÍCH, YÊU CẦU</b></p>"
                + "<p>1. Mục đích</p>"
                + "<p>a) Triển khai kịp thời;</p>"
                + "<p>2. Yêu cầu</p>"
                + "<p><b>II. NHIỆM VỤ</b></p>"
                + "<p>1. Tuyên truyền</p>"
                + "<p>Các nội dung tại Mục I được triển khai.</p>"
                + "</div>";

        LegalNode root = LegalDocumentParser.forDocumentType("Kế hoạch").parse(html, "Kế hoạch 45").root();

        assertThat(root.children()).extracting(LegalNode::title)
                .containsExactly("I. MỤC ĐÍCH, YÊU CẦU", "II. NHIỆM VỤ");
        LegalNode purpose = root.children().get(0);
        assertThat(purpose.children()).extracting(LegalNode::type).containsOnly(NodeType.ITEM);
        assertThat(purpose.children()).extracting(LegalNode::title).containsExactly("1", "2");
        assertThat(purpose.children().get(0).children()).extracting(LegalNode::title).containsExactly("a)");
        LegalNode tasks = root.children().get(1);
        assertThat(tasks.children()).singleElement().satisfies(item ->
                assertThat(item.content()).containsExactly("Tuyên truyền", "Các nội dung tại Mục I được triển khai."));
    }

    @Test
    void planKeepsLegalBasisSectionAsSection() {
        String html = "<div class=\"content1\">"
                + "<p><b>I. CĂN CỨ XÂY DỰNG KẾ HOẠCH</b></p>"
                + "<p>1. Luật Tổ chức chính quyền địa phương ngày 19 tháng 6 năm 2015;</p>"
                + "<p><b>II. MỤC ĐÍCH, YÊU CẦU</b></p>"
                + "<p>1. Mục đích</p>"
                + "</div>";

        LegalNode root = LegalDocumentParser.forDocumentType("Kế hoạch").parse(html, "Kế hoạch 12").root();

        assertThat(root.content()).isEmpty();
        assertThat(root.children()).extracting(LegalNode::type).containsExactly(NodeType.SECTION, NodeType.SECTION);
        assertThat(root.children()).extracting(LegalNode::title)
                .containsExactly("I. CĂN CỨ XÂY DỰNG KẾ HOẠCH", "II. MỤC ĐÍCH, YÊU CẦU");
        assertThat(root.children().get(0).children()).singleElement().satisfies(item -> {
            assertThat(item.type()).isEqualTo(NodeType.ITEM);
            assertThat(item.title()).isEqualTo("1");
        });
    }

    @Test
    void decisionAcceptsPlainArticlesWithoutChapters() {
        String html = "<p>QUYẾT ĐỊNH:</p>"
                + "<p>Điều 1. Phê duyệt Đề án.</p>"
                + "<p>Điều 2. Quyết định này có hiệu lực kể từ ngày ký.</p>"
                + "<p>Chương trình hành động kèm theo.</p>";

        LegalNode root = LegalDocumentParser.forDocumentType("Quyết định").parse(html, "QĐ 1").root();

        assertThat(root.content()).containsExactly("QUYẾT ĐỊNH:");
        assertThat(root.children()).extracting(LegalNode::type).containsOnly(NodeType.ARTICLE);
        assertThat(root.children()).hasSize(2);
        assertThat(root.children().get(1).content()).containsExactly("Chương trình hành động kèm theo.");
    }
}
