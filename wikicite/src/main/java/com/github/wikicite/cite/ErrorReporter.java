package com.github.wikicite.cite;

import java.util.List;
import java.util.Objects;

import org.apache.commons.text.StringEscapeUtils;
import org.jsoup.nodes.Element;

import com.github.wikicite.parsing.DataMwError;
import com.github.wikicite.parsing.DomDataUtils;
import com.github.wikicite.parsing.DomUtils;
import com.github.wikicite.parsing.ExtensionApi;
import com.ibm.icu.util.ULocale;

/**
 * Renders citation errors and warnings, either as inline HTML for the legacy
 * renderer or as structured {@code data-mw} errors on tree nodes. The severity
 * is part of the key: {@code cite_error_*} or {@code cite_warning_*}. Only
 * errors register the error tracking category.
 */
public class ErrorReporter {
    public static final String ERROR_TYPEOF = "mw:Error";

    private final ReferenceMessageLocalizer messageLocalizer;

    public ErrorReporter(ReferenceMessageLocalizer messageLocalizer) {
        this.messageLocalizer = Objects.requireNonNull(messageLocalizer);
    }

    /**
     * Like {@link #plain}, but the message text is passed through the host's
     * inline markup renderer first.
     */
    public String halfParsed(ParserContext parser, String key, Object... params) {
        var msg = msg(parser, key, params);
        var html = parser.recursiveTagParse(msg.plain());
        return wrapInHtmlContainer(html, key, msg.getLanguage());
    }

    public String plain(ParserContext parser, String key, Object... params) {
        var msg = msg(parser, key, params);
        return wrapInHtmlContainer(msg.plain(), key, msg.getLanguage());
    }

    private Message msg(ParserContext parser, String key, Object... params) {
        var language = parser.getContentLanguage();
        var msg = messageLocalizer.msg(key, params).inLanguage(language);
        var type = parseTypeAndIdFromMessageKey(msg.getKey())[0];

        if (type.equals("error")) {
            parser.addTrackingCategory(Cite.TRACKING_CATEGORY_ERROR);
        }

        return messageLocalizer.msg("cite_" + type, msg.plain()).inLanguage(language);
    }

    private static String wrapInHtmlContainer(String message, String key, ULocale language) {
        var typeAndId = parseTypeAndIdFromMessageKey(key);
        var type = typeAndId[0];
        var extraClass = type.equals("warning") ? " mw-ext-cite-warning-" + escapeClass(typeAndId[1]) : "";

        return String.format("<span class=\"%s mw-ext-cite-%s%s\" lang=\"%s\" dir=\"%s\">%s</span>",
            type, type, extraClass, StringEscapeUtils.escapeHtml4(langCode(language)), dir(language), message);
    }

    /**
     * Attaches errors to a node in detection order, after any it already
     * carries, and marks it as erroneous.
     */
    public void addErrorsToNode(ExtensionApi extApi, Element node, List<DataMwError> errs) {
        DomUtils.addTypeOf(node, ERROR_TYPEOF);
        var dataMw = DomDataUtils.getDataMw(node);
        dataMw.addErrors(errs);
        DomDataUtils.setDataMw(node, dataMw);

        for (var err : errs) {
            if (isError(err.getKey())) {
                extApi.addTrackingCategory(Cite.TRACKING_CATEGORY_ERROR);
            }
        }
    }

    /**
     * A standalone error span carrying both the localized text and the
     * structured error.
     */
    public Element renderParsoidErrorSpan(ExtensionApi extApi, String key, String... params) {
        var language = extApi.getContentLanguage();
        var inner = messageLocalizer.msg(key, (Object[]) params).inLanguage(language);
        var type = parseTypeAndIdFromMessageKey(key)[0];
        var text = messageLocalizer.msg("cite_" + type, inner.plain()).inLanguage(language);

        var span = new Element("span");
        span.attr("class", type + " mw-ext-cite-" + type);
        span.attr("lang", langCode(language));
        span.attr("dir", dir(language));
        span.append(text.plain());

        addErrorsToNode(extApi, span, List.of(new DataMwError(key, params)));
        return span;
    }

    static boolean isError(String key) {
        return parseTypeAndIdFromMessageKey(key)[0].equals("error");
    }

    /**
     * {@code cite_error_ref_no_key} yields {@code [error, ref_no_key]}.
     */
    static String[] parseTypeAndIdFromMessageKey(String key) {
        var parts = key.replace('-', '_').split("_", 3);

        if (parts.length < 2) {
            throw new IllegalArgumentException("Not a citation message key: " + key);
        }

        return new String[] { parts[1], parts.length > 2 ? parts[2] : "" };
    }

    private static String escapeClass(String id) {
        return id.replaceAll("[^\\w-]+", "_");
    }

    private static String langCode(ULocale language) {
        return language.toLanguageTag();
    }

    private static String dir(ULocale language) {
        return language.isRightToLeft() ? "rtl" : "ltr";
    }
}
