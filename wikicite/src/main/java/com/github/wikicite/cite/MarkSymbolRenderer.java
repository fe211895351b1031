package com.github.wikicite.cite;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * Turns numbers into the labels readers see: footnote marks such as
 * {@code 3}, {@code note 3} or a custom symbol, and back-link labels.
 */
public class MarkSymbolRenderer {
    private static final String CUSTOM_LABELS_PREFIX = "cite_link_label_group-";
    private static final String BACKLINK_LABELS = "cite_references_link_many_format_backlink_labels";
    private static final List<String> DEFAULT_ALPHABET = List.of(
        "a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m",
        "n", "o", "p", "q", "r", "s", "t", "u", "v", "w", "x", "y", "z"
    );

    private final ReferenceMessageLocalizer messageLocalizer;
    private final AlphabetsProvider alphabetsProvider;
    private final CiteConfig config;
    private final Map<String, List<String>> customLinkLabels = new HashMap<>();
    private List<String> legacyBacklinkLabels;

    public MarkSymbolRenderer(ReferenceMessageLocalizer messageLocalizer, AlphabetsProvider alphabetsProvider, CiteConfig config) {
        this.messageLocalizer = Objects.requireNonNull(messageLocalizer);
        this.alphabetsProvider = Objects.requireNonNull(alphabetsProvider);
        this.config = Objects.requireNonNull(config);
    }

    public String makeLabel(String group, int number) {
        return makeLabel(group, number, null);
    }

    /**
     * Custom labels of the group are used while they last; past the end of
     * the list the default numeric label takes over, the list never wraps.
     *
     * @param extendsIndex position among the parent's sub-references, appended
     * as {@code .n}; {@code null} for ordinary refs
     */
    public String makeLabel(String group, int number, Integer extendsIndex) {
        var label = fetchCustomizedLinkLabel(group, number);

        if (label == null) {
            label = makeDefaultLabel(group, number);
        }

        if (extendsIndex != null) {
            label += "." + messageLocalizer.localizeDigits(Integer.toString(extendsIndex));
        }

        return label;
    }

    private String makeDefaultLabel(String group, int number) {
        var label = messageLocalizer.localizeDigits(Integer.toString(number));
        return group.equals(Cite.DEFAULT_GROUP) ? label : group + " " + label;
    }

    private String fetchCustomizedLinkLabel(String group, int number) {
        if (group.equals(Cite.DEFAULT_GROUP)) {
            return null;
        }

        var labels = customLinkLabels.computeIfAbsent(group, g -> {
            var msg = messageLocalizer.msg(CUSTOM_LABELS_PREFIX + g);
            return msg.isDisabled() ? List.of() : List.of(StringUtils.split(msg.plain()));
        });

        return number >= 1 && number <= labels.size() ? labels.get(number - 1) : null;
    }

    /**
     * Label of the n-th back-link of a footnote referenced several times:
     * {@code a, b, ..., z, aa, ab, ...} in the content language's alphabet.
     */
    public String makeBacklinkLabel(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Back-link numbers start at 1, got " + number);
        }

        if (config.isUseLegacyBacklinkLabels()) {
            if (legacyBacklinkLabels == null) {
                var msg = messageLocalizer.msg(BACKLINK_LABELS);
                legacyBacklinkLabels = msg.isDisabled() ? List.of() : List.of(StringUtils.split(msg.plain()));
            }

            if (number <= legacyBacklinkLabels.size()) {
                return legacyBacklinkLabels.get(number - 1);
            }
        }

        var alphabet = alphabetsProvider.getIndexCharacters(messageLocalizer.getLanguage());
        return buildAlphaLabel(alphabet.isEmpty() ? DEFAULT_ALPHABET : alphabet, number);
    }

    private static String buildAlphaLabel(List<String> alphabet, int number) {
        var radix = alphabet.size();
        var sb = new StringBuilder();

        while (number > 0) {
            number--;
            sb.insert(0, alphabet.get(number % radix));
            number /= radix;
        }

        return sb.toString();
    }
}
