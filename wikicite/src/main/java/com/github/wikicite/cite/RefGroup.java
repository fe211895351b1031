package com.github.wikicite.cite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import com.github.wikicite.parsing.DomUtils;
import com.github.wikicite.parsing.ExtensionApi;

/**
 * The footnotes sharing a group label, in render order.
 */
public class RefGroup {
    private static final String SINGLE_BACKLINK_TEXT = "↑";

    private final String name;
    final List<RefGroupItem> refs = new ArrayList<>();
    final Map<String, RefGroupItem> indexByName = new HashMap<>();

    RefGroup(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public List<RefGroupItem> getRefs() {
        return Collections.unmodifiableList(refs);
    }

    public RefGroupItem getByName(String refName) {
        return indexByName.get(refName);
    }

    void add(RefGroupItem ref) {
        refs.add(ref);

        if (ref.hasName()) {
            indexByName.put(ref.name, ref);
        }
    }

    /**
     * Appends the list entry of a footnote to {@code refsList}. The footnote
     * content is moved out of the content store, which forgets it.
     */
    public void renderLine(ExtensionApi extApi, Element refsList, RefGroupItem ref, MarkSymbolRenderer markSymbolRenderer) {
        var li = new Element("li");
        li.attr("about", "#" + ref.target);
        li.attr("id", ref.target);

        if (ref.dir.equals("ltr") || ref.dir.equals("rtl")) {
            li.attr("class", "mw-cite-dir-" + ref.dir);
        }

        var reftextSpan = new Element("span");
        reftextSpan.attr("id", "mw-reference-text-" + ref.target);
        reftextSpan.attr("class", "mw-reference-text reference-text");

        if (ref.contentId != null) {
            var content = DomUtils.assertElt(DomUtils.firstChild(extApi.getContentDom(ref.contentId)), "ref content");
            DomUtils.migrateChildren(content, reftextSpan);
            extApi.clearContentDom(ref.contentId);
        }

        if (ref.linkbacks.size() == 1) {
            var linkback = createLinkback(extApi, ref.id, ref.group, SINGLE_BACKLINK_TEXT);
            linkback.attr("rel", "mw:referencedBy");
            li.appendChild(linkback);
        } else {
            var span = new Element("span");
            span.attr("rel", "mw:referencedBy");

            for (int i = 0; i < ref.linkbacks.size(); i++) {
                var label = markSymbolRenderer.makeBacklinkLabel(i + 1);
                span.appendChild(createLinkback(extApi, ref.linkbacks.get(i), ref.group, label));
            }

            li.appendChild(span);
        }

        li.appendChild(new TextNode(" "));
        li.appendChild(reftextSpan);
        refsList.appendChild(li);
    }

    private static Element createLinkback(ExtensionApi extApi, String linkback, String group, String text) {
        var a = new Element("a");
        a.attr("href", extApi.getPageUri() + "#" + linkback);

        if (!group.isEmpty()) {
            a.attr("data-mw-group", group);
        }

        var span = new Element("span");
        span.attr("class", "mw-linkback-text");
        span.appendChild(new TextNode(text + " "));
        a.appendChild(span);
        return a;
    }

    @Override
    public String toString() {
        return String.format("%s (%d refs)", name.isEmpty() ? "<default>" : name, refs.size());
    }
}
