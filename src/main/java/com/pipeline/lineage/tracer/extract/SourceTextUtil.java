package com.pipeline.lineage.tracer.extract;

import java.util.regex.Pattern;

/**
 * Text clean-up shared by the extractors.
 */
public final class SourceTextUtil {

    private static final Pattern SAS_BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern SAS_LINE_COMMENT = Pattern.compile("^\\s*\\*.*?;\\s*$", Pattern.MULTILINE);

    private SourceTextUtil() {
        // Utility class
    }

    /**
     * Removes {@code /* ... *}{@code /} blocks and full-line {@code * remark;} statements.
     */
    public static String stripSasComments(String text) {
        String withoutBlocks = SAS_BLOCK_COMMENT.matcher(text).replaceAll(" ");
        return SAS_LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }

    /**
     * Blanks out quoted literals so statement patterns cannot match inside them.
     * A doubled quote inside a literal is an escaped quote; an unterminated literal runs to
     * the end of the text. Offsets are preserved.
     */
    public static String stripStringLiterals(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (ch != '\'' && ch != '"') {
                out.append(ch);
                i++;
                continue;
            }
            int j = i + 1;
            boolean closed = false;
            while (j < n) {
                if (text.charAt(j) == ch) {
                    if (j + 1 < n && text.charAt(j + 1) == ch) {
                        j += 2;
                        continue;
                    }
                    j++;
                    closed = true;
                    break;
                }
                j++;
            }
            if (!closed) {
                j = n;
            }
            out.append(" ".repeat(j - i));
            i = j;
        }
        return out.toString();
    }

    /**
     * Removes BOM and zero-width characters, turns non-breaking spaces into spaces.
     */
    public static String normalizeInvisibles(String s) {
        return s.replace("\uFEFF", "").replace("\u200B", "").replace('\u00A0', ' ');
    }
}
