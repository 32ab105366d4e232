package work.lcod.liquid.text;

/**
 * Computes the visible slice of a text span.
 *
 * <p>Greedy trimming removes every whitespace character on a stripped side. Minimal trimming
 * stops at the first line break met on that side and keeps it, so at most one line break
 * survives per side.
 */
public final class WhitespaceTrimmer {
    private WhitespaceTrimmer() {}

    public static String trim(String text, boolean stripLeft, boolean stripRight, boolean greedy) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int start = 0;
        int end = text.length();

        if (stripLeft) {
            while (start < end) {
                char c = text.charAt(start);
                if (!Character.isWhitespace(c)) {
                    break;
                }
                if (!greedy && (c == '\n' || c == '\r')) {
                    break;
                }
                start++;
            }
        }

        if (stripRight) {
            while (end > start) {
                char c = text.charAt(end - 1);
                if (!Character.isWhitespace(c)) {
                    break;
                }
                if (!greedy && c == '\n') {
                    break;
                }
                end--;
            }
        }

        if (start == 0 && end == text.length()) {
            return text;
        }
        return text.substring(start, end);
    }
}
