package com.github.wikicite.cite;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Builds the ids footnote marks and footnotes point at each other with:
 * {@code cite_ref-...} for marks in the text, {@code cite_note-...} for
 * entries in the list. Target methods return the escaped form for an
 * {@code id} attribute, link methods the form for a URL fragment.
 */
public class AnchorFormatter {
    private static final String BACKLINK_PREFIX = "cite_ref-";
    private static final String NOTE_PREFIX = "cite_note-";
    private static final Pattern P_SPACES = Pattern.compile(" ");
    private static final Pattern P_UNDERSCORES = Pattern.compile("[_\\s]+");
    private static final String UNSAFE_IN_FRAGMENT = "%\"<>[]{}|\\^`";

    public String backLink(String key, String num) {
        return escapeIdForLink(makeBacklinkId(key, num));
    }

    public String backLinkTarget(String key, String num) {
        return escapeIdForAttribute(makeBacklinkId(key, num));
    }

    public String jumpLink(String key) {
        return escapeIdForLink(NOTE_PREFIX + key);
    }

    public String jumpLinkTarget(String key) {
        return escapeIdForAttribute(NOTE_PREFIX + key);
    }

    /**
     * Normalizes a ref name for use inside an id that also appears verbatim in
     * link fragments: URL-unsafe characters are escaped, whitespace and
     * underscore runs collapse into a single underscore.
     */
    public String normalizeKey(String key) {
        return P_UNDERSCORES.matcher(escapeIdForLink(key)).replaceAll("_");
    }

    private static String makeBacklinkId(String key, String num) {
        return num != null ? BACKLINK_PREFIX + key + "_" + num : BACKLINK_PREFIX + key;
    }

    static String escapeIdForAttribute(String id) {
        return P_SPACES.matcher(id).replaceAll("_");
    }

    static String escapeIdForLink(String id) {
        var escaped = escapeIdForAttribute(id);
        var sb = new StringBuilder(escaped.length());

        escaped.codePoints().forEach(cp -> {
            if (cp < 0x20 || cp == 0x7f || (cp < 0x80 && UNSAFE_IN_FRAGMENT.indexOf(cp) != -1)) {
                for (var b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append(String.format("%%%02X", b & 0xff));
                }
            } else {
                sb.appendCodePoint(cp);
            }
        });

        return sb.toString();
    }
}
