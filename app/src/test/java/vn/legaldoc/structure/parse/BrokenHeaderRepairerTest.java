package vn.legaldoc.structure.parse;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import vn.legaldoc.structure.html.SourceLine;

class BrokenHeaderRepairerTest {

    private final BrokenHeaderRepairer repairer = new BrokenHeaderRepairer(PatternTable.get());

    @Test
    void joinsBareKeywordWithItsNumber() {
        List<SourceLine> repaired = repairer.repair(List.of(
                SourceLine.bold("Điều"),
                SourceLine.plain("5. Phạm vi điều chỉnh"),
                SourceLine.plain("Nội dung")));

        assertThat(repaired).extracting(SourceLine::text)
                .containsExactly("Điều 5. Phạm vi điều chỉnh", "Nội dung");
        assertThat(repaired.get(0).bold()).isTrue();
    }

    @Test
    void emptyLineAfterBareArticleIsNotATitle() {
        List<SourceLine> repaired = repairer.repair(List.of(
                SourceLine.plain("Điều 5."),
                SourceLine.plain("")));

        assertThat(repaired).extracting(SourceLine::text).containsExactly("Điều 5.", "");
    }

    @Test
    void joinsBareArticleWithTitleLine() {
        List<SourceLine> repaired = repairer.repair(List.of(
                SourceLine.anchored("Điều 5.", true, "dieu_5"),
                SourceLine.plain("Phạm vi điều chỉnh"),
                SourceLine.plain("1. Luật này quy định")));

        assertThat(repaired).extracting(SourceLine::text)
                .containsExactly("Điều 5. Phạm vi điều chỉnh", "1. Luật này quy định");
        assertThat(repaired.get(0).anchorId()).contains("dieu_5");
    }

    @Test
    void bareArticleKeepsFollowingClauseOrPoint() {
        List<SourceLine> repaired = repairer.repair(List.of(
                SourceLine.bold("Điều 5"),
                SourceLine.plain("a) Trường hợp một"),
                SourceLine.bold("Điều 6:"),
                SourceLine.plain("2. Khoản hai")));

        assertThat(repaired).extracting(SourceLine::text)
                .containsExactly("Điều 5", "a) Trường hợp một", "Điều 6:", "2. Khoản hai");
    }

    @Test
    void joinsChapterWithUpperCaseTitleLines() {
        List<SourceLine> repaired = repairer.repair(List.of(
                SourceLine.bold("Chương"),
                SourceLine.bold("II"),
                SourceLine.plain("QUYỀN VÀ NGHĨA VỤ"),
                SourceLine.bold("CỦA CÔNG DÂN"),
                SourceLine.bold("Điều 10. Quyền của công dân")));

        assertThat(repaired).extracting(SourceLine::text)
                .containsExactly("Chương II QUYỀN VÀ NGHĨA VỤ CỦA CÔNG DÂN", "Điều 10. Quyền của công dân");
    }

    @Test
    void chapterStopsAtOrdinaryTextAndOtherHeaders() {
        List<SourceLine> repaired = repairer.repair(List.of(
                SourceLine.bold("Chương I"),
                SourceLine.plain("Quy định chung về quản lý"),
                SourceLine.bold("Chương I"),
                SourceLine.bold("Mục 1. NGUYÊN TẮC")));

        assertThat(repaired).extracting(SourceLine::text)
                .containsExactly("Chương I", "Quy định chung về quản lý", "Chương I", "Mục 1. NGUYÊN TẮC");
    }

    @Test
    void keywordAtEndOfDocumentIsKept() {
        assertThat(repairer.repair(List.of(SourceLine.plain("Điều")))).extracting(SourceLine::text)
                .containsExactly("Điều");
        assertThat(repairer.repair(List.of())).isEmpty();
    }
}
