package com.threadbox.backend.shared;

public final class TextPreview {
    private TextPreview() {}

    public static final String ELLIPSIS = "...";

    /**
     * Cuts {@code text} after {@code maxChars} characters and appends "..." when
     * anything was dropped. Characters are Unicode code points, so a cut never
     * splits a surrogate pair. The cut is not word aware.
     */
    public static String of(String text, int maxChars) {
        if (text == null) return "";
        if (length(text) <= maxChars) return text;
        return text.substring(0, text.offsetByCodePoints(0, maxChars)) + ELLIPSIS;
    }

    /** Number of code points, 0 for null. */
    public static int length(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }
}
