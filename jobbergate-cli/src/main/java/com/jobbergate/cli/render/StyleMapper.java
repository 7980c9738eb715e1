package com.jobbergate.cli.render;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column name to picocli ANSI style ({@code "green"}, {@code "bold,cyan"}, ...).
 * Columns without an entry are printed unstyled.
 */
public record StyleMapper(Map<String, String> styles) {

    public static final StyleMapper NONE = new StyleMapper(Map.of());

    public StyleMapper {
        styles = Map.copyOf(styles);
    }

    public static StyleMapper of(String... columnStylePairs) {
        if (columnStylePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Expected column/style pairs");
        }
        Map<String, String> styles = new LinkedHashMap<>();
        for (int i = 0; i < columnStylePairs.length; i += 2) {
            styles.put(columnStylePairs[i], columnStylePairs[i + 1]);
        }
        return new StyleMapper(styles);
    }

    public String styleFor(String column) {
        return styles.get(column);
    }
}
