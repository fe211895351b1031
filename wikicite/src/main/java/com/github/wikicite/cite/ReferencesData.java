package com.github.wikicite.cite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.github.wikicite.parsing.DataMwError;

/**
 * State of one document conversion: the groups found so far, the enclosing
 * {@code <references>} section, if any, and whether the traversal is inside
 * content that lives out of the tree. Not reusable across documents.
 */
public class ReferencesData {
    static final String EMBED = "embed";
    static final String REFERENCES = "references";

    private final AnchorFormatter anchorFormatter;
    private final Map<String, RefGroup> refGroups = new LinkedHashMap<>();
    private final Map<String, List<DataMwError>> embeddedErrors = new HashMap<>();
    private final Deque<String> embeddedContentStack = new ArrayDeque<>();
    private String referencesGroup = Cite.DEFAULT_GROUP;
    private int index;

    public ReferencesData(AnchorFormatter anchorFormatter) {
        this.anchorFormatter = Objects.requireNonNull(anchorFormatter);
    }

    public String getReferencesGroup() {
        return referencesGroup;
    }

    public void setReferencesGroup(String referencesGroup) {
        this.referencesGroup = Objects.requireNonNull(referencesGroup);
    }

    public boolean inReferencesContent() {
        return embeddedContentStack.contains(REFERENCES);
    }

    /**
     * True inside any out-of-line content, {@code <references>} bodies
     * included.
     */
    public boolean inEmbeddedContent() {
        return !embeddedContentStack.isEmpty();
    }

    public ContentFlag pushEmbeddedContentFlag() {
        return pushEmbeddedContentFlag(EMBED);
    }

    /**
     * Enters a nested content scope, left again when the returned flag is
     * closed. Use with try-with-resources.
     */
    public ContentFlag pushEmbeddedContentFlag(String needle) {
        embeddedContentStack.push(needle);
        return new ContentFlag();
    }

    public RefGroup getRefGroup(String groupName) {
        return getRefGroup(groupName, false);
    }

    public RefGroup getRefGroup(String groupName, boolean allocIfMissing) {
        if (allocIfMissing) {
            return refGroups.computeIfAbsent(groupName, RefGroup::new);
        }

        return refGroups.get(groupName);
    }

    public void removeRefGroup(String groupName) {
        refGroups.remove(groupName);
    }

    public Map<String, RefGroup> getRefGroups() {
        return Collections.unmodifiableMap(refGroups);
    }

    public List<DataMwError> getEmbeddedErrors(String about) {
        return embeddedErrors.getOrDefault(about, List.of());
    }

    public boolean hasEmbeddedErrors() {
        return !embeddedErrors.isEmpty();
    }

    void putEmbeddedErrors(String about, List<DataMwError> errs) {
        embeddedErrors.put(about, new ArrayList<>(errs));
    }

    /**
     * Creates a footnote at the end of its group. Ids follow the document-wide
     * creation order: {@code cite_ref-N}/{@code cite_note-N} for anonymous
     * refs, {@code cite_ref-NAME_N}/{@code cite_note-NAME-N} for named ones.
     */
    public RefGroupItem add(String groupName, String refName, String extendsRef, String refDir) {
        var group = getRefGroup(groupName, true);
        var hasRefName = !refName.isEmpty();
        var n = index++;
        var refKey = Integer.toString(n + 1);

        var ref = new RefGroupItem();
        ref.name = refName;
        ref.group = group.getName();
        ref.groupIndex = group.refs.size() + 1;
        ref.index = n;
        ref.dir = refDir;

        if (hasRefName) {
            var normalized = anchorFormatter.normalizeKey(refName);
            ref.key = "cite_ref-" + normalized + "_" + refKey;
            ref.id = ref.key + "-0";
            ref.target = "cite_note-" + normalized + "-" + refKey;
        } else {
            ref.key = "cite_ref-" + refKey;
            ref.id = ref.key;
            ref.target = "cite_note-" + refKey;
        }

        if (extendsRef != null && !extendsRef.isEmpty()) {
            ref.extendsRef = extendsRef;
            var parent = group.getByName(extendsRef);

            if (parent != null) {
                ref.parent = parent;
                ref.extendsIndex = ++parent.extensionCount;
            }
        }

        group.add(ref);
        return ref;
    }

    /**
     * A scope opened by {@link #pushEmbeddedContentFlag(String)}.
     */
    public final class ContentFlag implements AutoCloseable {
        private boolean closed;

        private ContentFlag() {}

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                embeddedContentStack.pop();
            }
        }
    }
}
