package vn.legaldoc.structure.parse;

import java.util.regex.Pattern;

/**
 * Process-wide, immutable table of the textual header conventions of Vietnamese legal
 * documents. Built once on first use and shared by every parse.
 */
public final class PatternTable {

    private static final int VIETNAMESE_CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final Pattern part;
    private final Pattern chapter;
    private final Pattern romanHeading;
    private final Pattern section;
    private final Pattern article;
    private final Pattern looseArticle;
    private final Pattern looseNumbering;
    private final Pattern point;
    private final Pattern appendix;
    private final Pattern recipients;
    private final Pattern inlineRecipients;
    private final Pattern signature;
    private final Pattern bareKeyword;
    private final Pattern bareArticle;
    private final Pattern bareChapter;
    private final Pattern leadingNumeral;

    private PatternTable() {
        // A header may follow a lead-in such as "... như sau:" on the same rendered line.
        String leadIn = "^(?:.*[.:]\\s*)?";
        part = Pattern.compile(leadIn + "(Phần\\s+(?:thứ\\s+)?[\\p{L}0-9]+.*)$", VIETNAMESE_CI);
        chapter = Pattern.compile(leadIn + "(Chương\\s+[IVXLC0-9]+\\b.*)$", VIETNAMESE_CI);
        romanHeading = Pattern.compile("^([IVXLC]+)\\.\\s*(.*)$");
        section = Pattern.compile(leadIn + "(Mục\\s+[0-9IVXLC]+\\b.*)$", VIETNAMESE_CI);
        article = Pattern.compile("^(Điều\\s+\\d+[a-zđ]?)\\s*[.:]?\\s*(.*)$", VIETNAMESE_CI);
        looseArticle = Pattern.compile("^(Điều|ĐIỀU)\\s+\\d+[a-zđ]?\\s*[.:]");
        looseNumbering = Pattern.compile("^(\\d{1,3}(?:\\.\\d{1,2})*)(\\.?)(?:\\s+(.*))?$");
        point = Pattern.compile("^([a-zđ])([).])\\s+(.*)$");
        appendix = Pattern.compile("^(?:Phụ\\s+lục|Mẫu\\s+số|Biểu\\s+mẫu)(?=$|[\\s:.,\\-])", VIETNAMESE_CI);
        recipients = Pattern.compile("^(Nơi\\s+nhận|Nơi\\s+gửi)\\s*[:;]", VIETNAMESE_CI);
        inlineRecipients = Pattern.compile("[.;]\\s+((?:Nơi\\s+nhận|Nơi\\s+gửi)\\s*:.*)$", VIETNAMESE_CI);
        signature = Pattern.compile("^(?:(?i:TM|KT|TL|PP|Q)\\.|(?iu:Thay\\s+mặt|Ký\\s+thay)\\b"
                + "|CHỦ\\s+TỊCH|PHÓ\\s+CHỦ\\s+TỊCH|THỦ\\s+TƯỚNG|PHÓ\\s+THỦ\\s+TƯỚNG|BỘ\\s+TRƯỞNG|THỨ\\s+TRƯỞNG"
                + "|THỐNG\\s+ĐỐC|TỔNG\\s+GIÁM\\s+ĐỐC|GIÁM\\s+ĐỐC|QUYỀN\\s+(?:CHỦ|BỘ|THỦ|GIÁM|TỔNG|THỐNG|CHÁNH|VIỆN)|CHÁNH\\s+ÁN|VIỆN\\s+TRƯỞNG)");
        bareKeyword = Pattern.compile("^(Điều|Chương)\\s*[.:]?$", VIETNAMESE_CI);
        bareArticle = Pattern.compile("^Điều\\s+\\d+[a-zđ]?\\s*[.:]?$", VIETNAMESE_CI);
        bareChapter = Pattern.compile("^Chương\\s+[IVXLC0-9]+\\s*[.:]?$", VIETNAMESE_CI);
        leadingNumeral = Pattern.compile("^(?:\\d+|[IVXLC]+\\b)");
    }

    public static PatternTable get() {
        return Holder.INSTANCE;
    }

    public Pattern part() {
        return part;
    }

    public Pattern chapter() {
        return chapter;
    }

    /**
     * Upper-case Roman numeral followed by a period, e.g. {@code "II. NHIỆM VỤ"}.
     */
    public Pattern romanHeading() {
        return romanHeading;
    }

    public Pattern section() {
        return section;
    }

    public Pattern article() {
        return article;
    }

    /**
     * Article header with explicit punctuation, the only form accepted without bold in loose
     * documents.
     */
    public Pattern looseArticle() {
        return looseArticle;
    }

    /**
     * {@code "1."}, {@code "2.1"} or {@code "2.1."} followed by optional text. Group 1 is the
     * number, group 2 the trailing period, group 3 the remaining text.
     */
    public Pattern looseNumbering() {
        return looseNumbering;
    }

    public Pattern point() {
        return point;
    }

    public Pattern appendix() {
        return appendix;
    }

    public Pattern recipients() {
        return recipients;
    }

    /**
     * Recipients marker rendered after other content on the same line; group 1 starts at the
     * marker.
     */
    public Pattern inlineRecipients() {
        return inlineRecipients;
    }

    public Pattern signature() {
        return signature;
    }

    public Pattern bareKeyword() {
        return bareKeyword;
    }

    public Pattern bareArticle() {
        return bareArticle;
    }

    public Pattern bareChapter() {
        return bareChapter;
    }

    public Pattern leadingNumeral() {
        return leadingNumeral;
    }

    private static final class Holder {
        private static final PatternTable INSTANCE = new PatternTable();
    }
}
