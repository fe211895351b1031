package com.github.wikicite.parsing;

import org.jsoup.nodes.Element;

/**
 * The host's HTML to wikitext serializer.
 */
public interface WikitextSerializer {
    String htmlToWikitext(String extName, String html);

    /**
     * Source of the start tag of an extension wrapper, self-closed when the
     * wrapper has no body.
     */
    String extStartTagToWikitext(Element node);
}
