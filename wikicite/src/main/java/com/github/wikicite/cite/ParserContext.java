package com.github.wikicite.cite;

import com.ibm.icu.util.ULocale;

/**
 * The legacy, string-based renderer hosting the citation code.
 */
public interface ParserContext {
    /**
     * Language of the content being rendered; messages shown inside the
     * content are produced in this language, not the reader's.
     */
    ULocale getContentLanguage();

    /**
     * Renders inline markup (links, formatting) found in message text.
     */
    String recursiveTagParse(String text);

    void addTrackingCategory(String key);
}
