package com.github.wikicite.parsing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

public final class DomUtils {
    public static final String TYPEOF = "typeof";
    private static final String SEALED_FRAGMENT_PREFIX = "mw:DOMFragment/sealed/";

    private DomUtils() {}

    public static boolean hasTypeOf(Node node, String type) {
        if (!(node instanceof Element el) || !el.hasAttr(TYPEOF)) {
            return false;
        }

        return Arrays.asList(StringUtils.split(el.attr(TYPEOF))).contains(type);
    }

    public static void addTypeOf(Element el, String type) {
        var types = new ArrayList<>(Arrays.asList(StringUtils.split(el.attr(TYPEOF))));

        if (!types.contains(type)) {
            types.add(type);
            el.attr(TYPEOF, String.join(" ", types));
        }
    }

    public static void removeTypeOf(Element el, String type) {
        var types = Arrays.stream(StringUtils.split(el.attr(TYPEOF)))
            .filter(t -> !t.equals(type))
            .collect(Collectors.joining(" "));

        if (types.isEmpty()) {
            el.removeAttr(TYPEOF);
        } else {
            el.attr(TYPEOF, types);
        }
    }

    /**
     * Whether the node is the placeholder of a sealed extension fragment of
     * the given extension, e.g. {@code ref}.
     */
    public static boolean isSealedFragmentOfType(Node node, String type) {
        return hasTypeOf(node, SEALED_FRAGMENT_PREFIX + type);
    }

    public static String sealedFragmentType(String type) {
        return SEALED_FRAGMENT_PREFIX + type;
    }

    public static Node firstChild(Node node) {
        return node.childNodeSize() != 0 ? node.childNode(0) : null;
    }

    /**
     * Moves every child of {@code from} to the end of {@code to}, in order.
     */
    public static void migrateChildren(Element from, Element to) {
        for (var child : new ArrayList<>(from.childNodes())) {
            to.appendChild(child);
        }
    }

    public static Element findAncestorOfName(Node node, String tagName) {
        var parent = node.parent();

        while (parent instanceof Element el) {
            if (el.normalName().equals(tagName)) {
                return el;
            }

            parent = el.parent();
        }

        return null;
    }

    public static Element assertElt(Node node, String what) {
        if (node instanceof Element el) {
            return el;
        }

        throw new ParsingException(String.format("Expected an element as %s, got: %s", what, node));
    }

    /**
     * Creates an empty fragment root: the body of a fresh shell document
     * configured for byte-stable serialization.
     */
    public static Element createFragment() {
        var doc = Document.createShell("");
        doc.outputSettings().prettyPrint(false);
        return doc.body();
    }

    public static Element parseFragment(String html) {
        var doc = Jsoup.parseBodyFragment(html);
        doc.outputSettings().prettyPrint(false);
        return doc.body();
    }

    /**
     * Serializes a node without pretty-printing, regardless of the settings of
     * the document it belongs to.
     */
    public static String toHtml(Node node, boolean innerHtml) {
        var doc = node.ownerDocument();

        if (doc == null || doc.outputSettings().prettyPrint()) {
            var holder = createFragment();
            var copy = node.clone();
            holder.appendChild(copy);
            node = copy;
        }

        if (!innerHtml) {
            return node.outerHtml();
        } else if (node instanceof Element el) {
            return el.html();
        } else {
            return "";
        }
    }
}
