package vn.legaldoc.structure.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import vn.legaldoc.structure.model.NodeType;

class DuplicateMergerTest {

    @Test
    void equalTitlesIgnoringCaseAndTrailingPeriods() {
        assertThat(DuplicateMerger.isDuplicate(NodeType.CHAPTER, "CHƯƠNG I", NodeType.CHAPTER, "Chương I.")).isTrue();
        assertThat(DuplicateMerger.isDuplicate(NodeType.ARTICLE, "Điều  1", NodeType.ARTICLE, "Điều 1")).isTrue();
    }

    @Test
    void delimiterBoundedPrefixIsDuplicate() {
        assertThat(DuplicateMerger.isDuplicate(NodeType.ARTICLE, "Điều 1", NodeType.ARTICLE, "Điều 1. Phạm vi")).isTrue();
        assertThat(DuplicateMerger.isDuplicate(NodeType.ARTICLE, "Điều 1: Phạm vi", NodeType.ARTICLE, "Điều 1")).isTrue();
        assertThat(DuplicateMerger.isDuplicate(NodeType.CHAPTER, "Chương I", NodeType.CHAPTER, "Chương I QUY ĐỊNH CHUNG")).isTrue();
    }

    @Test
    void numberContinuationIsNotDuplicate() {
        assertThat(DuplicateMerger.isDuplicate(NodeType.ARTICLE, "Điều 1", NodeType.ARTICLE, "Điều 10")).isFalse();
        assertThat(DuplicateMerger.isDuplicate(NodeType.CLAUSE, "1", NodeType.CLAUSE, "1.1")).isFalse();
        assertThat(DuplicateMerger.isDuplicate(NodeType.CLAUSE, "1", NodeType.CLAUSE, "1.1.")).isFalse();
        assertThat(DuplicateMerger.isDuplicate(NodeType.CLAUSE, "1", NodeType.CLAUSE, "2")).isFalse();
    }

    @Test
    void differentTypesNeverMerge() {
        assertThat(DuplicateMerger.isDuplicate(NodeType.ITEM, "1", NodeType.SUBITEM, "1")).isFalse();
    }

    @Test
    void normalizesTitles() {
        assertThat(DuplicateMerger.normalize("  Điều 5.. ")).isEqualTo("điều 5");
    }
}
