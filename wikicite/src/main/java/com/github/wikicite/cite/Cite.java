package com.github.wikicite.cite;

import java.util.Objects;

import org.jsoup.nodes.Element;

import com.github.wikicite.parsing.ExtensionApi;
import com.ibm.icu.util.ULocale;

/**
 * Entry point wiring the citation components for one content language.
 */
public class Cite {
    public static final String DEFAULT_GROUP = "";

    /** Attribute of a sub-reference naming the ref it refines. */
    public static final String SUBREF_ATTRIBUTE = "extends";

    public static final String TRACKING_CATEGORY_ERROR = "cite-tracking-category-cite-error";
    public static final String TRACKING_CATEGORY_DIFFING_ERROR = "cite-tracking-category-cite-diffing-error";

    public static final String MODULE_UX_ENHANCEMENTS = "ext.cite.ux-enhancements";
    public static final String MODULE_PARSOID_STYLES = "ext.cite.parsoid.styles";
    public static final String MODULE_STYLES = "ext.cite.styles";

    private final CiteConfig config;
    private final ReferenceMessageLocalizer messageLocalizer;
    private final AnchorFormatter anchorFormatter;
    private final MarkSymbolRenderer markSymbolRenderer;
    private final ErrorReporter errorReporter;
    private final FootnoteMarkFormatter footnoteMarkFormatter;
    private final RefTagHandler refTagHandler;
    private final References references;
    private final RefProcessor refProcessor;

    public Cite(CiteConfig config, ReferenceMessageLocalizer messageLocalizer) {
        this.config = Objects.requireNonNull(config);
        this.messageLocalizer = Objects.requireNonNull(messageLocalizer);
        anchorFormatter = new AnchorFormatter();
        markSymbolRenderer = new MarkSymbolRenderer(messageLocalizer, new AlphabetsProvider(), config);
        errorReporter = new ErrorReporter(messageLocalizer);
        footnoteMarkFormatter = new FootnoteMarkFormatter(anchorFormatter, markSymbolRenderer, messageLocalizer);
        refTagHandler = new RefTagHandler();
        references = new References(config, markSymbolRenderer, errorReporter);
        refProcessor = new RefProcessor(references, anchorFormatter);
    }

    /**
     * Uses the configuration shipped in {@code cite.properties}.
     */
    public static Cite forLanguage(ULocale contentLanguage) {
        return new Cite(CiteConfig.load(), new ReferenceMessageLocalizer(contentLanguage));
    }

    /**
     * Rewrites all refs of a converted document, see {@link RefProcessor}.
     */
    public ReferencesData process(ExtensionApi extApi, Element root) {
        return refProcessor.process(extApi, root);
    }

    public CiteConfig getConfig() {
        return config;
    }

    public ReferenceMessageLocalizer getMessageLocalizer() {
        return messageLocalizer;
    }

    public AnchorFormatter getAnchorFormatter() {
        return anchorFormatter;
    }

    public MarkSymbolRenderer getMarkSymbolRenderer() {
        return markSymbolRenderer;
    }

    public ErrorReporter getErrorReporter() {
        return errorReporter;
    }

    public FootnoteMarkFormatter getFootnoteMarkFormatter() {
        return footnoteMarkFormatter;
    }

    public RefTagHandler getRefTagHandler() {
        return refTagHandler;
    }

    public References getReferences() {
        return references;
    }
}
