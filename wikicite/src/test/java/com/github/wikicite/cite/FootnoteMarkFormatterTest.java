package com.github.wikicite.cite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Objects;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FootnoteMarkFormatter Tests")
class FootnoteMarkFormatterTest {
    @Mock
    private AnchorFormatter anchorFormatter;

    @Mock
    private ParserContext parser;

    private FootnoteMarkFormatter formatter;

    @BeforeEach
    void setUp() {
        when(anchorFormatter.jumpLink(anyString())).then(returnsFirstArg());
        when(anchorFormatter.backLinkTarget(anyString(), any()))
            .thenAnswer(inv -> inv.getArgument(0) + "+" + Objects.requireNonNullElse(inv.getArgument(1), ""));
        when(parser.recursiveTagParse(anyString())).then(returnsFirstArg());

        var localizer = new ReferenceMessageLocalizer(ReferenceMessageLocalizer.QQX, Map.of("cite_link_label_group-foo", "a b c"));
        var renderer = new MarkSymbolRenderer(localizer, new AlphabetsProvider(), new CiteConfig());
        formatter = new FootnoteMarkFormatter(anchorFormatter, renderer, localizer);
    }

    private static RefGroupItem ref(String group, int groupIndex, int index) {
        var ref = new RefGroupItem();
        ref.group = group;
        ref.groupIndex = groupIndex;
        ref.index = index;
        return ref;
    }

    @Test
    @DisplayName("Should link an anonymous ref of the default group")
    void shouldLinkAnonymousRef() {
        assertThat(formatter.linkRef(parser, ref("", 50003, 50003)))
            .isEqualTo("(cite_reference_link|50004+|50004|50003)");
    }

    @Test
    @DisplayName("Should prefix the label with the group name")
    void shouldLinkGroupedRef() {
        assertThat(formatter.linkRef(parser, ref("bar", 3, 3)))
            .isEqualTo("(cite_reference_link|4+|4|bar 3)");
    }

    @Test
    @DisplayName("Should use custom group labels while they last")
    void shouldLinkCustomLabelledRef() {
        assertThat(formatter.linkRef(parser, ref("foo", 3, 3)))
            .isEqualTo("(cite_reference_link|4+|4|c)");
        assertThat(formatter.linkRef(parser, ref("foo", 10, 10)))
            .isEqualTo("(cite_reference_link|11+|11|foo 10)");
    }

    @Test
    @DisplayName("Should key named refs by name and occurrence")
    void shouldLinkNamedRef() {
        var ref = ref("", 3, 3);
        ref.name = "a";
        ref.linkbacks.add("cite_ref-a_4-0");

        assertThat(formatter.linkRef(parser, ref)).isEqualTo("(cite_reference_link|a+4-0|a-4|3)");

        ref.linkbacks.add("cite_ref-a_4-1");

        assertThat(formatter.linkRef(parser, ref)).isEqualTo("(cite_reference_link|a+4-1|a-4|3)");
    }

    @Test
    @DisplayName("Should label sub-references after their parent")
    void shouldLinkSubreference() {
        var parent = ref("", 3, 2);
        parent.name = "p";
        var sub = ref("", 4, 5);
        sub.parent = parent;
        sub.extendsRef = "p";
        sub.extendsIndex = 2;

        assertThat(formatter.linkRef(parser, sub)).isEqualTo("(cite_reference_link|6+|6|3.2)");
    }
}
