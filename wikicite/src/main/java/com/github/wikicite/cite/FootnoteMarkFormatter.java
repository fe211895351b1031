package com.github.wikicite.cite;

import java.util.Objects;

/**
 * Renders the in-text footnote mark of the legacy, string-based renderer.
 */
public class FootnoteMarkFormatter {
    private final AnchorFormatter anchorFormatter;
    private final MarkSymbolRenderer markSymbolRenderer;
    private final ReferenceMessageLocalizer messageLocalizer;

    public FootnoteMarkFormatter(AnchorFormatter anchorFormatter, MarkSymbolRenderer markSymbolRenderer,
            ReferenceMessageLocalizer messageLocalizer) {
        this.anchorFormatter = Objects.requireNonNull(anchorFormatter);
        this.markSymbolRenderer = Objects.requireNonNull(markSymbolRenderer);
        this.messageLocalizer = Objects.requireNonNull(messageLocalizer);
    }

    /**
     * Builds the mark for the latest occurrence of {@code ref}: the id it can
     * be jumped back to, the link to its footnote and its label.
     */
    public String linkRef(ParserContext parser, RefGroupItem ref) {
        var label = markSymbolRenderer.makeLabel(ref.getGroup(), ref.getLabelNumber(), ref.getExtendsIndex());
        var globalNumber = Integer.toString(ref.getIndex() + 1);

        String key;
        String count;
        String subkey;

        if (ref.hasName()) {
            key = ref.getName();
            count = globalNumber + "-" + Math.max(ref.getLinkbacks().size() - 1, 0);
            subkey = "-" + globalNumber;
        } else {
            key = globalNumber;
            count = null;
            subkey = "";
        }

        var msg = messageLocalizer.msg("cite_reference_link",
            anchorFormatter.backLinkTarget(key, count),
            anchorFormatter.jumpLink(key + subkey),
            label
        );

        return parser.recursiveTagParse(msg.plain());
    }
}
