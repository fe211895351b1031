package com.github.wikicite.cite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jsoup.nodes.Element;

/**
 * One logical footnote: all occurrences of a name within a group, or a single
 * anonymous occurrence.
 */
public class RefGroupItem {
    String name = "";
    String group = Cite.DEFAULT_GROUP;
    int groupIndex;
    int index;
    String key;
    String id;
    String target;
    String dir = "";
    String contentId;
    String cachedHtml;
    String extendsRef;
    Integer extendsIndex;
    RefGroupItem parent;
    int extensionCount;
    final List<Element> nodes = new ArrayList<>();
    final List<String> embeddedNodes = new ArrayList<>();
    final List<String> linkbacks = new ArrayList<>();

    RefGroupItem() {}

    public String getName() {
        return name;
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    public String getGroup() {
        return group;
    }

    /** 1-based position in the rendered list of the group. */
    public int getGroupIndex() {
        return groupIndex;
    }

    /** 0-based creation order across the whole document. */
    public int getIndex() {
        return index;
    }

    public String getKey() {
        return key;
    }

    public String getId() {
        return id;
    }

    public String getTarget() {
        return target;
    }

    public String getDir() {
        return dir;
    }

    public String getContentId() {
        return contentId;
    }

    public String getExtendsRef() {
        return extendsRef;
    }

    public Integer getExtendsIndex() {
        return extendsIndex;
    }

    /**
     * Number the footnote mark shows: the parent's for sub-references, so
     * that the label reads as {@code parent.extendsIndex}.
     */
    public int getLabelNumber() {
        return parent != null ? parent.groupIndex : groupIndex;
    }

    public List<Element> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<String> getEmbeddedNodes() {
        return Collections.unmodifiableList(embeddedNodes);
    }

    public List<String> getLinkbacks() {
        return Collections.unmodifiableList(linkbacks);
    }

    @Override
    public String toString() {
        return String.format("%s [group=%s, groupIndex=%d, name=%s, content=%s]", target, group, groupIndex, name, contentId);
    }
}
