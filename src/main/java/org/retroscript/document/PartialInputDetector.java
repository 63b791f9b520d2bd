package org.retroscript.document;

/**
 * Heuristic for text that is still being typed. Text is partial when, ignoring trailing spaces
 * and tabs, it ends with an opening bracket or a comma, when it contains an odd number of
 * unescaped double quotes, or when it ends with a letter or digit and has grown since the
 * previous text.
 */
public class PartialInputDetector {

    public boolean isPartial(String text, String previousText) {
        String trimmed = stripSpacesAndTabs(text);
        if (trimmed.isEmpty()) {
            return false;
        }
        char last = trimmed.charAt(trimmed.length() - 1);
        if (last == '(' || last == '{' || last == '[' || last == ',') {
            return true;
        }
        if (unescapedQuotes(text) % 2 != 0) {
            return true;
        }
        int previousLength = previousText == null ? 0 : previousText.length();
        return Character.isLetterOrDigit(last) && text.length() > previousLength;
    }

    private static String stripSpacesAndTabs(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
            end--;
        }
        return text.substring(0, end);
    }

    private static int unescapedQuotes(String text) {
        int count = 0;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                count++;
            }
        }
        return count;
    }
}
