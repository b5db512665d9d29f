package io.mnemo.core.storage;

import java.util.Locale;
import java.util.regex.Pattern;

public final class Sanitizer {
    public static final char LIKE_ESCAPE = '\\';

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
    private static final Pattern KEYWORD = Pattern.compile("[A-Za-z0-9_]+");

    private Sanitizer() {
    }

    public static String identity(String raw) {
        if (raw == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(raw).replaceAll("").trim();
    }

    public static String likeContains(String raw) {
        String value = raw == null ? "" : raw;
        StringBuilder out = new StringBuilder(value.length() + 8).append('%');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                out.append(LIKE_ESCAPE);
            }
            out.append(c);
        }
        return out.append('%').toString();
    }

    public static String keyword(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (!KEYWORD.matcher(value).matches()) {
            throw new IllegalArgumentException("Illegal keyword: '" + raw + "'");
        }
        return value.toUpperCase(Locale.ROOT);
    }
}
