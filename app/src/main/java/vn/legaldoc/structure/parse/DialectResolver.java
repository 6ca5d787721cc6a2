package vn.legaldoc.structure.parse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import vn.legaldoc.structure.html.TextCleaner;

/**
 * Picks the dialect profile for a document from its declared type ({@code loai_van_ban}),
 * falling back to the title prefix and finally to {@link Dialect#HIERARCHICAL}.
 */
public final class DialectResolver {

    private static final Map<String, Dialect> DIALECTS_BY_TYPE = buildTypeMap();
    private static final List<String> TITLE_PREFIXES = List.of(
            "chỉ thị", "thông tư liên tịch", "thông tư", "quyết định", "nghị quyết", "kế hoạch", "hướng dẫn",
            "luật", "nghị định", "thông báo", "công điện", "thông tri", "pháp lệnh", "văn bản hợp nhất",
            "sắc lệnh", "lệnh", "báo cáo", "quy chế", "quy định");
    private static final List<String> LOOSE_TYPES = List.of(
            "chỉ thị", "thông tư", "nghị quyết", "kế hoạch", "quyết định", "hướng dẫn");

    private DialectResolver() {
    }

    public static DialectProfile resolve(String declaredType, String title) {
        String type = effectiveType(declaredType, title).orElse("");
        Dialect dialect = DIALECTS_BY_TYPE.getOrDefault(type, Dialect.HIERARCHICAL);
        return DialectProfile.of(dialect, isLooseType(type));
    }

    /**
     * Profile of a dialect chosen by the caller; the declared type still decides whether
     * article headers may be loose.
     */
    public static DialectProfile forDialect(Dialect dialect, String declaredType, String title) {
        String type = effectiveType(declaredType, title).orElse("");
        return DialectProfile.of(dialect, isLooseType(type));
    }

    public static DialectProfile resolve(String declaredType) {
        return resolve(declaredType, null);
    }

    /**
     * Normalized document type: the declared type when present, otherwise the genre the title
     * starts with.
     */
    public static Optional<String> effectiveType(String declaredType, String title) {
        String declared = normalize(declaredType);
        if (!declared.isEmpty()) {
            return Optional.of(declared);
        }
        String normalizedTitle = normalize(title);
        return TITLE_PREFIXES.stream()
                .filter(normalizedTitle::startsWith)
                .findFirst();
    }

    static boolean isLooseType(String normalizedType) {
        return LOOSE_TYPES.stream().anyMatch(normalizedType::contains);
    }

    private static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return TextCleaner.clean(raw).toLowerCase(Locale.ROOT);
    }

    private static Map<String, Dialect> buildTypeMap() {
        Map<String, Dialect> map = new LinkedHashMap<>();
        for (String type : List.of("luật", "thông tư", "thông tư liên tịch", "nghị định", "pháp lệnh",
                "văn bản hợp nhất", "quy chế", "quy định")) {
            map.put(type, Dialect.HIERARCHICAL);
        }
        for (String type : List.of("quyết định", "lệnh", "sắc lệnh", "nghị quyết")) {
            map.put(type, Dialect.DECISION);
        }
        for (String type : List.of("thông báo", "công điện", "thông tri")) {
            map.put(type, Dialect.DIRECTIVE);
        }
        for (String type : List.of("chỉ thị", "kế hoạch", "hướng dẫn", "báo cáo")) {
            map.put(type, Dialect.PLAN);
        }
        return Map.copyOf(map);
    }
}
