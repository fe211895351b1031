package com.github.wikicite.parsing;

import java.util.function.UnaryOperator;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import com.ibm.icu.util.ULocale;

/**
 * Everything the citation code needs from the document conversion it runs
 * in. One instance serves exactly one document.
 */
public interface ExtensionApi {
    /**
     * Returns the fragment root stored under the given id; its first child is
     * the extension's wrapper element.
     *
     * @throws ParsingException if no such fragment exists
     */
    Element getContentDom(String contentId);

    /**
     * Stores a fragment root out of line and returns its new content id.
     */
    String registerContentDom(Element fragment);

    void clearContentDom(String contentId);

    String domToHtml(Node node, boolean innerHtml);

    /**
     * Parses serialized HTML into a detached fragment root.
     */
    Element htmlToDom(String html);

    /**
     * Rewrites, in place, every piece of HTML the element carries inside its
     * attributes rather than as children.
     */
    void processAttributeEmbeddedHtml(Element element, UnaryOperator<String> processor);

    String getPageUri();

    /**
     * Length in bytes of the source being converted.
     */
    int getContentLength();

    String newAboutId();

    ULocale getContentLanguage();

    void addTrackingCategory(String key);

    void addModules(String... modules);

    void addModuleStyles(String... modules);

    void pushError(String key, String... params);

    String htmlToWikitext(String extName, String html);

    String extStartTagToWikitext(Element node);
}
