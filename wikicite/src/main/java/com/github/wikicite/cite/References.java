package com.github.wikicite.cite;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import com.github.wikicite.parsing.DataMw;
import com.github.wikicite.parsing.DataMwError;
import com.github.wikicite.parsing.DataParsoid;
import com.github.wikicite.parsing.DomDataUtils;
import com.github.wikicite.parsing.DomSourceRange;
import com.github.wikicite.parsing.DomUtils;
import com.github.wikicite.parsing.ExtensionApi;
import com.github.wikicite.parsing.ExtensionTag;

/**
 * Handles {@code <references>} containers and rewrites sealed {@code <ref>}
 * occurrences into footnote marks, collecting them into groups and rendering
 * each group into its container.
 */
public class References {
    public static final String TAG_NAME = "references";
    public static final String EXTENSION_TYPEOF = "mw:Extension/references";

    private static final String FOLLOW_TYPEOF = "mw:Cite/Follow";
    private static final String TRANSCLUSION_TYPEOF = "mw:Transclusion";
    private static final Set<String> VALID_REF_ATTRIBUTES = Set.of("group", "name", Cite.SUBREF_ATTRIBUTE, "follow", "dir");
    private static final Pattern P_DIGITS = Pattern.compile("[0-9]+");

    private final CiteConfig config;
    private final MarkSymbolRenderer markSymbolRenderer;
    private final ErrorReporter errorReporter;
    private final Logger logger = Logger.getLogger("cite");

    public References(CiteConfig config, MarkSymbolRenderer markSymbolRenderer, ErrorReporter errorReporter) {
        this.config = Objects.requireNonNull(config);
        this.markSymbolRenderer = Objects.requireNonNull(markSymbolRenderer);
        this.errorReporter = Objects.requireNonNull(errorReporter);
    }

    /**
     * Builds a container from a tokenized {@code <references>} tag.
     *
     * @param bodyHtml parsed body, usually a list of {@code <ref>} definitions;
     * {@code null} for self-closed tags
     */
    public Element sourceToDom(ExtensionApi extApi, ExtensionTag extTag, String bodyHtml) {
        var domFragment = bodyHtml != null ? extApi.htmlToDom(bodyHtml) : DomUtils.createFragment();
        String group = null;
        String responsive = null;
        var hasInvalidParameters = false;

        for (var entry : extTag.attrs().entrySet()) {
            switch (entry.getKey().toLowerCase(Locale.ROOT)) {
                case "group" -> group = entry.getValue();
                case "responsive" -> responsive = entry.getValue();
                default -> hasInvalidParameters = true;
            }
        }

        if (hasInvalidParameters) {
            extApi.pushError("cite_error_references_invalid_parameters");
        }

        var frag = createReferences(extApi, domFragment, extTag.attrs(), group, responsive, dp -> {
            dp.setSrc(extTag.source());
            dp.setDsr(extTag.dsr());
            dp.setSelfClose(extTag.isSelfClosed());
        });

        if (hasInvalidParameters) {
            // after the list, unlike the legacy renderer which puts it first
            frag.appendChild(errorReporter.renderParsoidErrorSpan(extApi, "cite_error_references_invalid_parameters"));
            extApi.addTrackingCategory(Cite.TRACKING_CATEGORY_DIFFING_ERROR);
        }

        return frag;
    }

    private Element createReferences(ExtensionApi extApi, Element domFragment, Map<String, String> attrs,
            String group, String responsive, Consumer<DataParsoid> modifyDp) {
        var ol = new Element("ol");
        ol.addClass("mw-references").addClass("references");
        DomUtils.migrateChildren(domFragment, ol);

        var responsiveWrap = responsive != null ? !responsive.equals("0") : config.isResponsiveReferences();
        Element frag;

        if (responsiveWrap) {
            frag = new Element("div");
            frag.addClass("mw-references-wrap");
            frag.appendChild(ol);
        } else {
            frag = ol;
        }

        DomUtils.addTypeOf(frag, EXTENSION_TYPEOF);
        frag.attr("about", extApi.newAboutId());

        var dataMw = new DataMw(TAG_NAME);
        dataMw.setAttrs(attrs);
        DomDataUtils.setDataMw(frag, dataMw);

        var dp = DomDataUtils.getDataParsoid(frag);

        if (StringUtils.isNotEmpty(group)) {
            dp.setGroup(group);
            ol.attr("data-mw-group", group);
        }

        modifyDp.accept(dp);
        DomDataUtils.setDataParsoid(frag, dp);

        extApi.addModules(Cite.MODULE_UX_ENHANCEMENTS);
        extApi.addModuleStyles(Cite.MODULE_PARSOID_STYLES, Cite.MODULE_STYLES);
        return frag;
    }

    /**
     * Walks the children of {@code node} in document order, turning every
     * sealed ref into a footnote mark and rendering every container once its
     * own children are done.
     */
    public void processRefs(ExtensionApi extApi, ReferencesData refsData, Element node) {
        var child = DomUtils.firstChild(node);

        while (child != null) {
            // the current child may be replaced or removed below
            var nextChild = child.nextSibling();

            if (child instanceof Element el) {
                if (DomUtils.isSealedFragmentOfType(el, RefTagHandler.TAG_NAME)) {
                    extractRefFromNode(extApi, el, refsData);
                } else if (DomUtils.hasTypeOf(el, EXTENSION_TYPEOF)) {
                    processReferencesContainer(extApi, refsData, el);
                } else {
                    try (var flag = refsData.pushEmbeddedContentFlag()) {
                        extApi.processAttributeEmbeddedHtml(el, html -> processEmbeddedRefs(extApi, refsData, html));
                    }

                    if (el.childNodeSize() != 0) {
                        processRefs(extApi, refsData, el);
                    }
                }
            }

            child = nextChild;
        }
    }

    private void processReferencesContainer(ExtensionApi extApi, ReferencesData refsData, Element container) {
        // the group of a nested container is ignored
        if (!refsData.inReferencesContent()) {
            var group = DomDataUtils.getDataParsoid(container).getGroup();
            refsData.setReferencesGroup(Objects.requireNonNullElse(group, Cite.DEFAULT_GROUP));
        }

        try (var flag = refsData.pushEmbeddedContentFlag(ReferencesData.REFERENCES)) {
            if (container.childNodeSize() != 0) {
                processRefs(extApi, refsData, container);
            }
        }

        if (!refsData.inReferencesContent()) {
            refsData.setReferencesGroup(Cite.DEFAULT_GROUP);
            insertReferencesIntoDOM(extApi, container, refsData, false);
        }
    }

    private String processEmbeddedRefs(ExtensionApi extApi, ReferencesData refsData, String html) {
        var domFragment = extApi.htmlToDom(html);
        processRefs(extApi, refsData, domFragment);
        return extApi.domToHtml(domFragment, true);
    }

    private static boolean hasRef(Element node) {
        for (var el : node.getAllElements()) {
            if (el != node && DomUtils.isSealedFragmentOfType(el, RefTagHandler.TAG_NAME)) {
                return true;
            }
        }

        return false;
    }

    private void extractRefFromNode(ExtensionApi extApi, Element node, ReferencesData refsData) {
        var errs = new ArrayList<DataMwError>();

        // data-parsoid of the placeholder, which went through source range
        // computation and template wrapping
        var nodeDp = DomDataUtils.getDataParsoid(node);
        var contentId = nodeDp.getHtml();
        var isTemplateWrapper = DomUtils.hasTypeOf(node, TRANSCLUSION_TYPEOF);
        var templateDataMw = isTemplateWrapper ? DomDataUtils.getDataMw(node) : null;

        var refFragment = DomUtils.assertElt(DomUtils.firstChild(extApi.getContentDom(contentId)), "ref content " + contentId);
        var refFragmentDp = DomDataUtils.getDataParsoid(refFragment);
        var refDataMw = DomDataUtils.getDataMw(refFragment);

        var attributes = refDataMw.getAttrs();

        if (!VALID_REF_ATTRIBUTES.containsAll(attributes.keySet())) {
            errs.add(new DataMwError("cite_error_ref_too_many_keys"));
        }

        var refName = attributes.getOrDefault("name", "");
        var followName = attributes.getOrDefault("follow", "");
        var refDir = attributes.getOrDefault("dir", "").toLowerCase(Locale.ROOT);
        var extendsRef = attributes.get(Cite.SUBREF_ATTRIBUTE);

        var groupName = attributes.containsKey("group") ? attributes.get("group") : refsData.getReferencesGroup();

        if (refsData.inReferencesContent() && !groupName.equals(refsData.getReferencesGroup())) {
            errs.add(new DataMwError("cite_error_references_group_mismatch", groupName));
        }

        var refGroup = refsData.getRefGroup(groupName);

        // the wrapper only carries an about id when it is a template sibling
        var about = node.hasAttr("about") ? node.attr("about") : refFragment.hasAttr("about") ? refFragment.attr("about") : null;

        var hasName = !refName.isEmpty();
        var hasFollow = !followName.isEmpty();

        if (hasFollow) {
            var followSpan = new Element("span");
            DomUtils.addTypeOf(followSpan, FOLLOW_TYPEOF);

            if (about != null) {
                followSpan.attr("about", about);
            }

            followSpan.appendChild(new TextNode(" "));
            DomUtils.migrateChildren(refFragment, followSpan);
            refFragment.appendChild(followSpan);
        }

        RefGroupItem ref = null;
        var refFragmentHtml = "";
        var hasDifferingContent = false;
        var hasValidFollow = false;

        if (hasName) {
            if (hasFollow) {
                errs.add(new DataMwError("cite_error_ref_follow_conflicts"));
            }

            ref = refGroup != null ? refGroup.getByName(refName) : null;

            if (ref != null) {
                // only the first definition is rendered, later ones with
                // other content keep theirs inline
                if (ref.contentId != null) {
                    if (ref.cachedHtml == null) {
                        var refContent = DomUtils.firstChild(extApi.getContentDom(ref.contentId));
                        ref.cachedHtml = normalizeRef(extApi.domToHtml(refContent, true));
                    }

                    refFragmentHtml = extApi.domToHtml(refFragment, true);
                    hasDifferingContent = !normalizeRef(refFragmentHtml).equals(ref.cachedHtml);
                }
            } else if (refsData.inReferencesContent()) {
                errs.add(new DataMwError("cite_error_references_missing_key", refName));
            }
        } else if (hasFollow) {
            var followed = refGroup != null ? refGroup.getByName(followName) : null;

            if (followed != null) {
                hasValidFollow = true;
                ref = followed;
            } else {
                errs.add(new DataMwError("cite_error_references_missing_key", followName));
            }
        } else if (refsData.inReferencesContent()) {
            errs.add(new DataMwError("cite_error_references_no_key"));
        }

        // nested refs go first, before this one is added or its content moves
        if (!refFragmentDp.isEmpty() && hasRef(refFragment)) {
            if (hasDifferingContent) {
                try (var flag = refsData.pushEmbeddedContentFlag()) {
                    processRefs(extApi, refsData, refFragment);
                }

                // the cached copy had its refs processed already, so this
                // will hardly ever match again
                refFragmentHtml = extApi.domToHtml(refFragment, true);
            } else {
                processRefs(extApi, refsData, refFragment);
            }
        }

        var linkBackSup = new Element("sup");

        if (hasValidFollow) {
            if (ref.contentId != null) {
                var refContent = DomUtils.assertElt(DomUtils.firstChild(extApi.getContentDom(ref.contentId)), "ref content " + ref.contentId);
                DomUtils.migrateChildren(refFragment, refContent);
            }
            // otherwise the follow content becomes the content of the ref below
        } else {
            // a ref defined by its own nested refs is not looked up again
            if (ref == null) {
                ref = refsData.add(groupName, refName, extendsRef, refDir);
            }

            if (refsData.inEmbeddedContent()) {
                ref.embeddedNodes.add(about);
            } else {
                ref.nodes.add(linkBackSup);
                ref.linkbacks.add(ref.key + "-" + ref.linkbacks.size());
            }
        }

        if (attributes.containsKey("dir")) {
            if (!refDir.equals("rtl") && !refDir.equals("ltr")) {
                errs.add(new DataMwError("cite_error_ref_invalid_dir", refDir));
            } else if (!ref.dir.isEmpty() && !ref.dir.equals(refDir)) {
                errs.add(new DataMwError("cite_error_ref_conflicting_dir", ref.name));
            }
        }

        if (P_DIGITS.matcher(refName).matches()) {
            errs.add(new DataMwError("cite_error_ref_numeric_key"));
        }

        var hasMissingContent = refFragmentDp.isEmpty() || StringUtils.isBlank(refDataMw.getBodyExtsrc());

        if (hasMissingContent) {
            if (refsData.inReferencesContent()) {
                errs.add(new DataMwError("cite_error_empty_references_define",
                    attributes.getOrDefault("name", ""), attributes.getOrDefault("group", "")));
            } else if (!hasName) {
                if (refFragmentDp.isSelfClose()) {
                    errs.add(new DataMwError("cite_error_ref_no_key"));
                } else {
                    errs.add(new DataMwError("cite_error_ref_no_input"));
                }
            }

            if (refFragmentDp.isSelfClose()) {
                refDataMw.removeBody();
            } else {
                refFragment.empty();
                refDataMw.setBodyHtml(Objects.requireNonNullElse(refDataMw.getBodyExtsrc(), ""));
            }
        } else {
            if (ref.contentId != null && !hasValidFollow) {
                refFragment.empty();
            }

            if (hasDifferingContent) {
                errs.add(new DataMwError("cite_error_references_duplicate_key", refName));
                refDataMw.setBodyHtml(refFragmentHtml);
            } else {
                refDataMw.setBodyId("mw-reference-text-" + ref.target);
            }
        }

        addLinkBackAttributes(linkBackSup, getLinkbackId(ref, refsData, hasValidFollow), node.attr(DomUtils.TYPEOF), about, hasValidFollow);
        addLinkBackData(linkBackSup, nodeDp, isTemplateWrapper ? templateDataMw : refDataMw);

        if (!errs.isEmpty()) {
            errorReporter.addErrorsToNode(extApi, linkBackSup, errs);
        }

        var refLink = new Element("a");
        refLink.attr("href", extApi.getPageUri() + "#" + ref.target);
        refLink.attr("style", "counter-reset: mw-Ref " + ref.groupIndex + ";");

        if (!ref.group.isEmpty()) {
            refLink.attr("data-mw-group", ref.group);
        }

        // default rendering for browsers without CSS counters
        var refLinkSpan = new Element("span");
        refLinkSpan.attr("class", "mw-reflink-text");
        var label = markSymbolRenderer.makeLabel(ref.group, ref.getLabelNumber(), ref.extendsIndex);
        refLinkSpan.appendChild(new TextNode("[" + label + "]"));

        refLink.appendChild(refLinkSpan);
        linkBackSup.appendChild(refLink);

        var aParent = DomUtils.findAncestorOfName(node, "a");

        if (aParent != null) {
            // hoisted right after the link, behind any mark hoisted before
            var insertionPoint = aParent.nextSibling();

            while (insertionPoint instanceof Element el && el.normalName().equals("sup")
                    && DomDataUtils.getDataParsoid(el).isMisnested()) {
                insertionPoint = el.nextSibling();
            }

            if (insertionPoint != null) {
                insertionPoint.before(linkBackSup);
            } else {
                aParent.parent().appendChild(linkBackSup);
            }

            var aDsr = DomDataUtils.getDataParsoid(aParent).getDsr();
            var dsrOffset = aDsr != null ? aDsr.getEnd() : null;
            setMisnested(linkBackSup, dsrOffset);
            setMisnested(refLink, dsrOffset);
            setMisnested(refLinkSpan, dsrOffset);

            if (aParent.hasAttr("about")) {
                linkBackSup.attr("about", aParent.attr("about"));
            }

            node.remove();
        } else {
            node.replaceWith(linkBackSup);
        }

        // the first definition with content is kept for comparison and rendering
        if (ref.contentId == null && !hasMissingContent) {
            ref.contentId = contentId;
            ref.dir = refDir;
        } else {
            refFragment.remove();
            extApi.clearContentDom(contentId);
        }
    }

    private static void setMisnested(Element node, Integer offset) {
        var dp = DomDataUtils.getDataParsoid(node);
        dp.setMisnested(true);
        dp.setDsr(DomSourceRange.zeroWidth(offset));
        DomDataUtils.setDataParsoid(node, dp);
    }

    private static void addLinkBackAttributes(Element linkBackSup, String id, String typeof, String about, boolean hasValidFollow) {
        if (about != null) {
            linkBackSup.attr("about", about);
        }

        linkBackSup.attr("class", hasValidFollow ? "mw-ref reference mw-ref-follow" : "mw-ref reference");

        if (id != null) {
            linkBackSup.attr("id", id);
        }

        linkBackSup.attr("rel", "dc:references");

        if (!typeof.isEmpty()) {
            linkBackSup.attr(DomUtils.TYPEOF, typeof);
        }

        DomUtils.removeTypeOf(linkBackSup, DomUtils.sealedFragmentType(RefTagHandler.TAG_NAME));
        DomUtils.addTypeOf(linkBackSup, RefTagHandler.EXTENSION_TYPEOF);
    }

    private static void addLinkBackData(Element linkBackSup, DataParsoid nodeDp, DataMw dataMw) {
        var dp = new DataParsoid();

        if (nodeDp.getSrc() != null) {
            dp.setSrc(nodeDp.getSrc());
        }

        if (nodeDp.getDsr() != null) {
            dp.setDsr(nodeDp.getDsr());
        }

        if (nodeDp.getPi() != null) {
            dp.setPi(nodeDp.getPi());
        }

        DomDataUtils.setDataParsoid(linkBackSup, dp);
        DomDataUtils.setDataMw(linkBackSup, dataMw);
    }

    private static String getLinkbackId(RefGroupItem ref, ReferencesData refsData, boolean hasValidFollow) {
        if (refsData.inEmbeddedContent() || hasValidFollow) {
            return null;
        }

        if (!ref.hasName()) {
            return ref.id;
        }

        return !ref.linkbacks.isEmpty() ? ref.linkbacks.get(ref.linkbacks.size() - 1) : null;
    }

    /**
     * Strips {@code data-parsoid} and {@code about}, which differ between
     * otherwise identical occurrences, so that content can be compared.
     * MathML and SVG subtrees are left alone.
     */
    String normalizeRef(String html) {
        var fragment = DomUtils.parseFragment(html);

        for (var el : fragment.getAllElements()) {
            if (el != fragment && !isForeignContent(el)) {
                el.removeAttr(DomDataUtils.DATA_PARSOID);
                el.removeAttr("about");
            }
        }

        return DomUtils.toHtml(fragment, true);
    }

    private static boolean isForeignContent(Element el) {
        for (var e = el; e != null; e = e.parent()) {
            if (e.normalName().equals("math") || e.normalName().equals("svg")) {
                return true;
            }
        }

        return false;
    }

    /**
     * Renders the group of a container into it, replacing whatever it held,
     * and forgets the group.
     */
    void insertReferencesIntoDOM(ExtensionApi extApi, Element refsNode, ReferencesData refsData, boolean autoGenerated) {
        var isTemplateWrapper = DomUtils.hasTypeOf(refsNode, TRANSCLUSION_TYPEOF);
        var nodeDp = DomDataUtils.getDataParsoid(refsNode);
        var groupName = Objects.requireNonNullElse(nodeDp.getGroup(), Cite.DEFAULT_GROUP);
        var refGroup = refsData.getRefGroup(groupName);

        // errors only known now; embedded occurrences are patched later
        if (refGroup != null) {
            var autoGeneratedWithGroup = autoGenerated && !groupName.isEmpty();

            for (var ref : refGroup.refs) {
                var errs = new ArrayList<DataMwError>();

                if (autoGeneratedWithGroup) {
                    errs.add(new DataMwError("cite_error_group_refs_without_references", groupName));
                }

                if (ref.hasName() && ref.contentId == null) {
                    errs.add(new DataMwError("cite_error_references_no_text", ref.name));
                }

                if (!errs.isEmpty()) {
                    for (var node : ref.nodes) {
                        errorReporter.addErrorsToNode(extApi, node, errs);
                    }

                    for (var about : ref.embeddedNodes) {
                        refsData.putEmbeddedErrors(about, errs);
                    }
                }
            }
        }

        List<String> nestedRefsHtml = refsNode.select("sup[typeof]").stream()
            .filter(sup -> DomUtils.hasTypeOf(sup, RefTagHandler.EXTENSION_TYPEOF))
            .map(sup -> extApi.domToHtml(sup, false) + "\n")
            .collect(Collectors.toList());

        if (!isTemplateWrapper) {
            var dataMw = DomDataUtils.getDataMw(refsNode);

            // clients may strip auto-generated containers
            if (autoGenerated) {
                dataMw.setAutoGenerated(true);
            } else if (!nestedRefsHtml.isEmpty()) {
                dataMw.setBodyHtml("\n" + String.join("", nestedRefsHtml));
            } else if (!nodeDp.isSelfClose()) {
                dataMw.setBodyHtml("");
            } else {
                dataMw.removeBody();
            }

            DomDataUtils.setDataMw(refsNode, dataMw);
            nodeDp.setSelfClose(false);
            DomDataUtils.setDataParsoid(refsNode, nodeDp);
        }

        var refsList = refsNode;

        if (refsNode.hasClass("mw-references-wrap")) {
            if (refGroup != null && refGroup.refs.size() > config.getResponsiveReferencesThreshold()) {
                refsNode.addClass("mw-references-columns");
            }

            refsList = DomUtils.assertElt(DomUtils.firstChild(refsNode), "references list");
        }

        // a container reused from a cache comes with stale entries
        refsList.empty();

        if (refGroup != null) {
            for (var ref : refGroup.refs) {
                refGroup.renderLine(extApi, refsList, ref, markSymbolRenderer);
            }

            logger.logp(Level.FINE, "References", "insertReferencesIntoDOM",
                String.format("Rendered %d refs of group '%s'", refGroup.refs.size(), groupName));
        }

        refsData.removeRefGroup(groupName);
    }

    /**
     * Renders the groups no container asked for into containers synthesized
     * at the end of {@code node}.
     */
    public void insertMissingReferencesIntoDOM(ExtensionApi extApi, ReferencesData refsData, Element node) {
        // rendering removes groups from the map
        var groupNames = new ArrayList<>(refsData.getRefGroups().keySet());

        for (var groupName : groupNames) {
            Map<String, String> attrs = groupName.isEmpty() ? Map.of() : Map.of("group", groupName);

            var frag = createReferences(extApi, DomUtils.createFragment(), attrs, groupName, null, dp -> {
                // no source of its own: zero-width at the end of the document
                var contentLength = extApi.getContentLength();
                dp.setDsr(new DomSourceRange(contentLength, contentLength, 0, 0));
            });

            // one container per line when serialized back
            node.appendChild(new TextNode("\n"));
            node.appendChild(frag);

            logger.logp(Level.FINE, "References", "insertMissingReferencesIntoDOM",
                String.format("Synthesized container for group '%s'", groupName));

            insertReferencesIntoDOM(extApi, frag, refsData, true);
        }
    }

    /**
     * Attaches the errors recorded for embedded occurrences, which were only
     * known once their content had already been serialized.
     */
    public void addEmbeddedErrors(ExtensionApi extApi, ReferencesData refsData, Element node) {
        var child = DomUtils.firstChild(node);

        while (child != null) {
            var nextChild = child.nextSibling();

            if (child instanceof Element el) {
                extApi.processAttributeEmbeddedHtml(el, html -> {
                    var domFragment = extApi.htmlToDom(html);
                    addEmbeddedErrors(extApi, refsData, domFragment);
                    return extApi.domToHtml(domFragment, true);
                });

                if (DomUtils.hasTypeOf(el, RefTagHandler.EXTENSION_TYPEOF)) {
                    var errs = refsData.getEmbeddedErrors(el.attr("about"));

                    if (!errs.isEmpty()) {
                        errorReporter.addErrorsToNode(extApi, el, errs);
                    }
                }

                if (el.childNodeSize() != 0) {
                    addEmbeddedErrors(extApi, refsData, el);
                }
            }

            child = nextChild;
        }
    }

    /**
     * Serializes a container back to a {@code <references>} tag.
     * Auto-generated containers of a named group are dropped: they only
     * exist because of an authoring error.
     */
    public String domToWikitext(ExtensionApi extApi, Element node) {
        var dataMw = DomDataUtils.getDataMw(node);

        if (dataMw.isAutoGenerated() && StringUtils.isNotEmpty(dataMw.getAttr("group"))) {
            return "";
        }

        var startTagSrc = extApi.extStartTagToWikitext(node);

        if (!dataMw.hasBody()) {
            return startTagSrc;
        }

        if (dataMw.getBodyHtml() == null) {
            logger.logp(Level.WARNING, "References", "domToWikitext", "References body unavailable for: " + node.outerHtml());
            return "";
        }

        var src = extApi.htmlToWikitext(dataMw.getName(), dataMw.getBodyHtml());
        return startTagSrc + src + "</" + dataMw.getName() + ">";
    }
}
