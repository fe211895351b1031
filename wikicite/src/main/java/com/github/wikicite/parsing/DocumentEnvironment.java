package com.github.wikicite.parsing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.apache.commons.collections4.Bag;
import org.apache.commons.collections4.BagUtils;
import org.apache.commons.collections4.bag.HashBag;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import com.ibm.icu.util.ULocale;

/**
 * In-memory {@link ExtensionApi} backed by jsoup: owns the output document,
 * the store of out-of-line content fragments and the page metadata collected
 * during one conversion.
 */
public class DocumentEnvironment implements ExtensionApi {
    private static final String CONTENT_ID_PREFIX = "mwf";
    private static final String ABOUT_ID_PREFIX = "#mwt";

    private final String pageUri;
    private final String source;
    private final ULocale contentLanguage;
    private final Document document;
    private final Map<String, Element> contentStore;
    private final Bag<String> trackingCategories;
    private final Set<String> modules;
    private final Set<String> moduleStyles;
    private final List<DataMwError> errors;
    private WikitextSerializer serializer;
    private int contentCounter;
    private int aboutCounter;

    public DocumentEnvironment(String pageUri, String source, ULocale contentLanguage) {
        this.pageUri = Objects.requireNonNull(pageUri);
        this.source = Objects.requireNonNull(source);
        this.contentLanguage = Objects.requireNonNull(contentLanguage);
        this.document = Document.createShell("");
        this.document.outputSettings().prettyPrint(false);
        this.contentStore = new HashMap<>();
        this.trackingCategories = new HashBag<>();
        this.modules = new LinkedHashSet<>();
        this.moduleStyles = new LinkedHashSet<>();
        this.errors = new ArrayList<>();
    }

    public DocumentEnvironment withSerializer(WikitextSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer);
        return this;
    }

    public Document getDocument() {
        return document;
    }

    public Element getBody() {
        return document.body();
    }

    @Override
    public String registerContentDom(Element fragment) {
        var id = CONTENT_ID_PREFIX + (++contentCounter);
        contentStore.put(id, fragment);
        return id;
    }

    public boolean hasContentDom(String contentId) {
        return contentStore.containsKey(contentId);
    }

    @Override
    public Element getContentDom(String contentId) {
        var fragment = contentStore.get(contentId);

        if (fragment == null) {
            throw new ParsingException("Unknown content id: " + contentId);
        }

        return fragment;
    }

    @Override
    public void clearContentDom(String contentId) {
        contentStore.remove(contentId);
    }

    @Override
    public String domToHtml(Node node, boolean innerHtml) {
        return DomUtils.toHtml(node, innerHtml);
    }

    @Override
    public Element htmlToDom(String html) {
        return DomUtils.parseFragment(html);
    }

    @Override
    public void processAttributeEmbeddedHtml(Element element, UnaryOperator<String> processor) {
        if (!DomDataUtils.hasDataMw(element)) {
            return;
        }

        var dataMw = DomDataUtils.getDataMw(element);
        var modified = false;

        if (isExtensionWrapper(element) && dataMw.getBodyHtml() != null) {
            dataMw.setBodyHtml(processor.apply(dataMw.getBodyHtml()));
            modified = true;
        }

        if (dataMw.getCaption() != null) {
            dataMw.setCaption(processor.apply(dataMw.getCaption()));
            modified = true;
        }

        var parts = dataMw.getParts();

        if (parts != null) {
            for (int i = 0; i < parts.length(); i++) {
                var part = parts.optJSONObject(i);
                var template = part != null ? part.optJSONObject("template") : null;
                var params = template != null ? template.optJSONObject("params") : null;

                if (params == null) {
                    continue;
                }

                for (var key : params.keySet()) {
                    var param = params.optJSONObject(key);

                    if (param != null && param.has("html")) {
                        param.put("html", processor.apply(param.getString("html")));
                        modified = true;
                    }
                }
            }
        }

        if (modified) {
            DomDataUtils.setDataMw(element, dataMw);
        }
    }

    private static boolean isExtensionWrapper(Element element) {
        for (var type : element.attr(DomUtils.TYPEOF).split("\\s+")) {
            if (type.startsWith("mw:Extension/")) {
                return true;
            }
        }

        return false;
    }

    @Override
    public String getPageUri() {
        return pageUri;
    }

    @Override
    public int getContentLength() {
        return source.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public String newAboutId() {
        return ABOUT_ID_PREFIX + (++aboutCounter);
    }

    @Override
    public ULocale getContentLanguage() {
        return contentLanguage;
    }

    @Override
    public void addTrackingCategory(String key) {
        trackingCategories.add(key);
    }

    public Bag<String> getTrackingCategories() {
        return BagUtils.unmodifiableBag(trackingCategories);
    }

    @Override
    public void addModules(String... modules) {
        Collections.addAll(this.modules, modules);
    }

    public Set<String> getModules() {
        return Collections.unmodifiableSet(modules);
    }

    @Override
    public void addModuleStyles(String... modules) {
        Collections.addAll(this.moduleStyles, modules);
    }

    public Set<String> getModuleStyles() {
        return Collections.unmodifiableSet(moduleStyles);
    }

    @Override
    public void pushError(String key, String... params) {
        errors.add(new DataMwError(key, params));
    }

    public List<DataMwError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public String htmlToWikitext(String extName, String html) {
        return requireSerializer().htmlToWikitext(extName, html);
    }

    @Override
    public String extStartTagToWikitext(Element node) {
        return requireSerializer().extStartTagToWikitext(node);
    }

    private WikitextSerializer requireSerializer() {
        if (serializer == null) {
            throw new UnsupportedOperationException("No wikitext serializer configured for " + pageUri);
        }

        return serializer;
    }

    @Override
    public String toString() {
        return String.format("%s (%d stored fragments)", pageUri, contentStore.size());
    }
}
